package com.whispers.api.inboxes;

import com.whispers.api.security.Identity;
import com.whispers.api.web.Validation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
class InboxController {

    private final InboxService inboxes;

    InboxController(InboxService inboxes) {
        this.inboxes = inboxes;
    }

    @GetMapping("/users/{userId}/inboxes")
    List<InboxView> list(@PathVariable UUID userId) {
        return inboxes.listForUser(userId).stream().map(InboxView::of).toList();
    }

    @PostMapping("/users/{userId}/inboxes")
    ResponseEntity<InboxView> create(@PathVariable UUID userId, @RequestBody(required = false) InboxRequest req) {
        var name = InboxChanges.checkName(Validation.requireBody(req).name());
        return ResponseEntity.status(HttpStatus.CREATED).body(InboxView.of(inboxes.create(userId, name)));
    }

    @GetMapping("/inboxes/{id}")
    InboxView get(@PathVariable UUID id, @AuthenticationPrincipal Identity caller) {
        return InboxView.of(inboxes.get(caller, id));
    }

    @PutMapping("/inboxes/{id}")
    InboxView update(@PathVariable UUID id, @RequestBody(required = false) InboxRequest req,
            @AuthenticationPrincipal Identity caller) {
        return InboxView.of(inboxes.update(caller, id, InboxChanges.from(req)));
    }

    @DeleteMapping("/inboxes/{id}")
    ResponseEntity<Void> delete(@PathVariable UUID id, @AuthenticationPrincipal Identity caller) {
        inboxes.delete(caller, id);
        return ResponseEntity.noContent().build();
    }
}
