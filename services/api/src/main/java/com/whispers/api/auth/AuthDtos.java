package com.whispers.api.auth;

import com.whispers.api.users.User;

import java.time.Instant;

record LoginRequest(String email, String password) {}
record StatusResponse(String message) {}
record IssuedSession(User user, String token, Instant expiresAt) {}
