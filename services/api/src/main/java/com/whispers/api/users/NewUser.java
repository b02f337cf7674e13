package com.whispers.api.users;

import com.whispers.api.auth.CredentialService;
import com.whispers.api.web.Validation;
import com.whispers.api.web.ValidationException;

import java.util.Locale;

/**
 * Body of {@code POST /users} and {@code POST /register}.
 */
public record NewUser(String username, String email, String password) {

    /**
     * Checks the required fields and returns a copy with the username trimmed and the email
     * trimmed and lower-cased.
     */
    public NewUser validated() {
        return new NewUser(
                checkUsername(Validation.requireText(username, "Username is required")),
                normalizeEmail(Validation.requireText(email, "Email is required")),
                checkPassword(Validation.requireNonEmpty(password, "Password is required")));
    }

    static String checkUsername(String username) {
        return Validation.requireMaxLength(username, User.USERNAME_MAX_LENGTH, "Username");
    }

    static String checkPassword(String password) {
        return Validation.requireMaxBytes(password, CredentialService.MAX_PASSWORD_BYTES, "Password");
    }

    static String normalizeEmail(String email) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.indexOf('@') <= 0) {
            throw new ValidationException("Email is invalid");
        }
        return Validation.requireMaxLength(normalized, User.EMAIL_MAX_LENGTH, "Email");
    }
}
