package com.whispers.api.auth;

import com.whispers.api.security.Identity;
import com.whispers.api.security.OwnershipPolicy;
import com.whispers.api.security.SessionTokens;
import com.whispers.api.users.NewUser;
import com.whispers.api.users.UserService;
import com.whispers.api.users.UserView;
import com.whispers.api.web.Validation;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@RestController
@RequestMapping("/api")
public class AuthController {

    private final AuthService auth;
    private final UserService users;
    private final OwnershipPolicy policy;
    private final Clock clock;
    private final boolean secureCookie;

    AuthController(AuthService auth, UserService users, OwnershipPolicy policy, Clock clock,
            @Value("${security.session.cookieSecure:true}") boolean secureCookie) {
        this.auth = auth;
        this.users = users;
        this.policy = policy;
        this.clock = clock;
        this.secureCookie = secureCookie;
    }

    @GetMapping("/register")
    StatusResponse registerPage() {
        return new StatusResponse("Register");
    }

    @PostMapping("/register")
    ResponseEntity<UserView> register(@RequestBody(required = false) NewUser req,
            @AuthenticationPrincipal Identity caller) {
        var user = auth.register(caller, req);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserView.of(user));
    }

    @PostMapping(path = "/register", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    ResponseEntity<UserView> registerForm(@ModelAttribute NewUser req, @AuthenticationPrincipal Identity caller) {
        return register(req, caller);
    }

    @PostMapping("/login")
    ResponseEntity<UserView> login(@RequestBody(required = false) LoginRequest req, HttpServletResponse res) {
        Validation.requireBody(req);
        var email = Validation.requireText(req.email(), "Email is required");
        var password = Validation.requireNonEmpty(req.password(), "Password is required");
        var out = auth.login(email, password);
        setSessionCookie(res, out.token(), out.expiresAt());
        return ResponseEntity.ok(UserView.of(out.user()));
    }

    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    ResponseEntity<UserView> loginForm(@ModelAttribute LoginRequest req, HttpServletResponse res) {
        return login(req, res);
    }

    @GetMapping("/logout")
    StatusResponse logout(HttpServletRequest req, HttpServletResponse res) {
        auth.logout(SessionTokens.fromRequest(req));
        clearSessionCookie(res);
        return new StatusResponse("Logout");
    }

    @GetMapping("/account")
    UserView account(@AuthenticationPrincipal Identity caller) {
        return UserView.of(users.get(policy.requireIdentity(caller).userId()));
    }

    private void setSessionCookie(HttpServletResponse res, String token, Instant expiresAt) {
        var c = new Cookie(SessionTokens.COOKIE_NAME, token);
        c.setHttpOnly(true);
        c.setSecure(secureCookie);
        c.setPath("/api");
        c.setMaxAge((int) Duration.between(clock.instant(), expiresAt).getSeconds());
        res.addCookie(c);
    }

    private void clearSessionCookie(HttpServletResponse res) {
        var c = new Cookie(SessionTokens.COOKIE_NAME, "");
        c.setHttpOnly(true);
        c.setSecure(secureCookie);
        c.setPath("/api");
        c.setMaxAge(0);
        res.addCookie(c);
    }
}
