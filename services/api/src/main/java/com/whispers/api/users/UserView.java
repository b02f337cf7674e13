package com.whispers.api.users;

import java.time.Instant;
import java.util.UUID;

/**
 * Public representation of a user. Never carries the password hash.
 */
public record UserView(UUID id, String username, String email, Instant createdAt, Instant updatedAt) {

    public static UserView of(User user) {
        return new UserView(user.getId(), user.getUsername(), user.getEmail(), user.getCreatedAt(),
                user.getUpdatedAt());
    }
}
