package com.whispers.api.web;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * Tells a clash on a named unique constraint apart from other integrity failures.
 */
public final class UniqueConstraints {

    private static final String UNIQUE_VIOLATION = "23505";

    public static boolean isViolated(DataIntegrityViolationException e, String constraintName) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException) {
                var violation = (ConstraintViolationException) t;
                var name = violation.getConstraintName();
                if (name != null) {
                    // some drivers report the backing index, e.g. "PUBLIC.UK_USERS_EMAIL_INDEX_4 ON ..."
                    return name.toLowerCase(Locale.ROOT).contains(constraintName);
                }
                return UNIQUE_VIOLATION.equals(violation.getSQLState());
            }
        }
        return false;
    }

    private UniqueConstraints() {}
}
