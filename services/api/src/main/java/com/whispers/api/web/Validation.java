package com.whispers.api.web;

import java.nio.charset.StandardCharsets;

/**
 * Required-field checks shared by the request handlers.
 */
public final class Validation {

    public static <T> T requireBody(T body) {
        if (body == null) {
            throw new ValidationException("Request body is required");
        }
        return body;
    }

    /** Returns the trimmed value, or fails when it is null or blank. */
    public static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
        return value.trim();
    }

    /** Like {@link #requireText} but keeps the value as given; used for passwords. */
    public static String requireNonEmpty(String value, String message) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(message);
        }
        return value;
    }

    public static String requireMaxLength(String value, int max, String field) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters");
        }
        return value;
    }

    /** Length limit counted in UTF-8 bytes, for values handed to byte-oriented primitives. */
    public static String requireMaxBytes(String value, int max, String field) {
        if (value != null && value.getBytes(StandardCharsets.UTF_8).length > max) {
            throw new ValidationException(field + " must be at most " + max + " bytes");
        }
        return value;
    }

    private Validation() {}
}
