package com.whispers.api.users;

import com.whispers.api.web.Validation;
import com.whispers.api.web.ValidationException;

import java.util.Optional;

/**
 * A partial update of a user. Each present value replaces the stored one; absent values are
 * left alone. The password is plaintext here and hashed before it is stored.
 */
public record UserChanges(Optional<String> username, Optional<String> email, Optional<String> password) {

    public static UserChanges from(UserUpdateRequest request) {
        Validation.requireBody(request);
        var changes = new UserChanges(
                Optional.ofNullable(request.username())
                        .map(v -> NewUser.checkUsername(Validation.requireText(v, "Username must not be empty"))),
                Optional.ofNullable(request.email())
                        .map(v -> NewUser.normalizeEmail(Validation.requireText(v, "Email must not be empty"))),
                Optional.ofNullable(request.password())
                        .map(v -> NewUser.checkPassword(Validation.requireNonEmpty(v, "Password must not be empty"))));
        if (changes.username().isEmpty() && changes.email().isEmpty() && changes.password().isEmpty()) {
            throw new ValidationException("No fields to update");
        }
        return changes;
    }
}
