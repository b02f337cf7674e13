package com.whispers.api.auth;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of an issued session token. The token itself is never stored; its
 * {@code jti} claim is this row's id. Logging out deletes the row.
 */
@Entity
@Table(name = "user_session")
class UserSession {

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false)
    UUID userId;

    @Column(nullable = false)
    Instant issuedAt;

    @Column(nullable = false)
    Instant expiresAt;

    protected UserSession() {}

    UserSession(UUID userId, Instant issuedAt, Instant expiresAt) {
        this.userId = userId;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    boolean isLiveAt(Instant now) {
        return expiresAt.isAfter(now);
    }
}
