package com.whispers.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Signs and verifies session tokens. A token is an HS256 JWT whose subject is the user id and
 * whose {@code jti} is the id of the persisted session row.
 */
@Component
public class SessionTokens {

    public static final String COOKIE_NAME = "session";

    private static final String BEARER = "Bearer ";

    private final SecretKey key;
    private final JwtParser parser;

    public SessionTokens(@Value("${security.session.secret}") String secret, Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issue(Identity identity, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .subject(identity.userId().toString())
                .id(identity.sessionId().toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
    }

    /**
     * Returns the identity a token names, or null when the token is malformed, carries a bad
     * signature, or has expired.
     */
    public Identity tryParse(String token) {
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            if (claims.getSubject() == null || claims.getId() == null) {
                return null;
            }
            return new Identity(UUID.fromString(claims.getSubject()), UUID.fromString(claims.getId()));
        } catch (JwtException | IllegalArgumentException e) {
            return null;
        }
    }

    /** The bearer token if present, otherwise the session cookie; null when neither is set. */
    public static String fromRequest(HttpServletRequest request) {
        String auth = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.startsWith(BEARER)) {
            String token = auth.substring(BEARER.length()).trim();
            return token.isEmpty() ? null : token;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (COOKIE_NAME.equals(cookie.getName()) && !cookie.getValue().isEmpty()) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
