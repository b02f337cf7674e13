package com.whispers.api.web;

import org.springframework.http.HttpStatus;

/**
 * Base for every failure the API reports to its caller. Carries the HTTP status and a stable
 * machine-readable code; the message is safe to show to clients.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
