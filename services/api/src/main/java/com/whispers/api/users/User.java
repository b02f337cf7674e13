package com.whispers.api.users;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users",
        uniqueConstraints = @UniqueConstraint(name = User.EMAIL_CONSTRAINT, columnNames = "email"))
public class User {

    public static final String EMAIL_CONSTRAINT = "uk_users_email";
    public static final int USERNAME_MAX_LENGTH = 64;
    public static final int EMAIL_MAX_LENGTH = 120;

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false, length = USERNAME_MAX_LENGTH)
    String username;

    @Column(nullable = false, length = EMAIL_MAX_LENGTH)
    String email;

    @Column(nullable = false)
    String passwordHash;

    @Column(nullable = false)
    boolean active;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    Instant updatedAt;

    protected User() {}

    public User(String username, String email, String passwordHash) {
        this.username = username;
        this.email = email;
        this.passwordHash = passwordHash;
        this.active = true;
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
