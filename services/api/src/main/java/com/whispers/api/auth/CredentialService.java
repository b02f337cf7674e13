package com.whispers.api.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password digests. {@link #verify} answers false for anything it cannot check rather
 * than throwing.
 */
@Component
public class CredentialService {

    /** BCrypt only reads this many bytes of a password. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final PasswordEncoder encoder;

    CredentialService(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    public String hash(String plaintext) {
        return encoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(plaintext, digest);
        } catch (IllegalArgumentException e) {
            log.debug("Password digest could not be checked: {}", e.getMessage());
            return false;
        }
    }
}
