package com.whispers.api.auth;

import com.whispers.api.security.Identity;
import com.whispers.api.security.SessionTokens;
import com.whispers.api.security.UnauthenticatedException;
import com.whispers.api.users.NewUser;
import com.whispers.api.users.User;
import com.whispers.api.users.UserRepository;
import com.whispers.api.users.UserService;
import com.whispers.api.web.Validation;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Session lifecycle: login issues a token valid for a fixed window from the login call, logout
 * deletes its session row, and {@link #resolve} turns a presented token back into an
 * {@link Identity}.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository users;
    private final UserService userService;
    private final UserSessionRepository sessions;
    private final CredentialService credentials;
    private final SessionTokens tokens;
    private final Clock clock;
    private final Duration sessionTtl;

    AuthService(UserRepository users, UserService userService, UserSessionRepository sessions,
            CredentialService credentials, SessionTokens tokens, Clock clock,
            @Value("${security.session.ttlSeconds:86400}") long sessionTtlSeconds) {
        this.users = users;
        this.userService = userService;
        this.sessions = sessions;
        this.credentials = credentials;
        this.tokens = tokens;
        this.clock = clock;
        this.sessionTtl = Duration.ofSeconds(sessionTtlSeconds);
    }

    /** Signs up a new user; callers that already hold a session are turned away. */
    public User register(Identity caller, NewUser req) {
        if (caller != null) {
            throw new AlreadyAuthenticatedException();
        }
        return userService.create(Validation.requireBody(req).validated());
    }

    IssuedSession login(String email, String password) {
        var user = users.findByEmailIgnoreCase(email.trim().toLowerCase(Locale.ROOT))
                .filter(User::isActive)
                .orElse(null);
        if (user == null || !credentials.verify(password, user.getPasswordHash())) {
            log.warn("Rejected login email={}", email);
            throw new InvalidCredentialsException();
        }

        var issuedAt = clock.instant();
        int pruned = sessions.deleteExpired(user.getId(), issuedAt);
        if (pruned > 0) {
            log.debug("Pruned expired sessions user={} count={}", user.getId(), pruned);
        }
        var expiresAt = issuedAt.plus(sessionTtl);
        var session = sessions.save(new UserSession(user.getId(), issuedAt, expiresAt));
        var token = tokens.issue(new Identity(user.getId(), session.id), issuedAt, expiresAt);
        log.info("Opened session id={} user={} expiresAt={}", session.id, user.getId(), expiresAt);
        return new IssuedSession(user, token, expiresAt);
    }

    /**
     * Ends the session a token names by deleting its row. Missing, malformed, expired and already
     * closed tokens are ignored.
     */
    public void logout(String token) {
        if (token == null) {
            return;
        }
        var identity = tokens.tryParse(token);
        if (identity == null) {
            return;
        }
        sessions.findById(identity.sessionId()).ifPresent(s -> {
            sessions.delete(s);
            log.info("Closed session id={} user={}", s.id, s.userId);
        });
    }

    public Identity resolve(HttpServletRequest request) {
        return resolve(SessionTokens.fromRequest(request));
    }

    public Identity resolve(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthenticatedException("No session");
        }
        var identity = tokens.tryParse(token);
        if (identity == null) {
            throw new UnauthenticatedException("Invalid or expired session");
        }
        var session = sessions.findById(identity.sessionId())
                .filter(s -> s.userId.equals(identity.userId()))
                .orElseThrow(() -> new UnauthenticatedException("Unknown session"));
        if (!session.isLiveAt(clock.instant())) {
            throw new UnauthenticatedException("Invalid or expired session");
        }
        if (!users.findById(identity.userId()).map(User::isActive).orElse(false)) {
            throw new UnauthenticatedException("Unknown user");
        }
        return identity;
    }
}
