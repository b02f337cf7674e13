package com.whispers.api.security;

import java.util.UUID;

/**
 * The authenticated caller: the user a valid session belongs to, and that session.
 */
public record Identity(UUID userId, UUID sessionId) {}
