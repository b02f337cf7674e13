package com.whispers.api.inboxes;

import com.whispers.api.users.User;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * An inbox owned by exactly one user. Names are unique per owner, not globally.
 */
@Entity
@Table(name = "inboxes",
        uniqueConstraints = @UniqueConstraint(name = Inbox.NAME_CONSTRAINT, columnNames = {"user_id", "name"}))
public class Inbox {

    public static final String NAME_CONSTRAINT = "uk_inboxes_user_name";
    public static final int NAME_MAX_LENGTH = 64;

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    String name;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    User user;

    @Column(length = 255)
    String url;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    Instant updatedAt;

    protected Inbox() {}

    public Inbox(String name, User user) {
        this.name = name;
        this.user = user;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public UUID getOwnerId() {
        return user.getId();
    }

    public String getUrl() {
        return url;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
