package com.whispers.api.users;

import com.whispers.api.security.Identity;
import com.whispers.api.web.Validation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/users")
class UserController {

    private final UserService users;

    UserController(UserService users) {
        this.users = users;
    }

    @GetMapping("/{id}")
    UserView get(@PathVariable UUID id) {
        return UserView.of(users.get(id));
    }

    @PostMapping
    ResponseEntity<UserView> create(@RequestBody(required = false) NewUser req) {
        var user = users.create(Validation.requireBody(req).validated());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserView.of(user));
    }

    @PutMapping("/{id}")
    UserView update(@PathVariable UUID id, @RequestBody(required = false) UserUpdateRequest req,
            @AuthenticationPrincipal Identity caller) {
        return UserView.of(users.update(caller, id, UserChanges.from(req)));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable UUID id, @AuthenticationPrincipal Identity caller) {
        users.delete(caller, id);
        return ResponseEntity.noContent().build();
    }
}
