package com.whispers.api.auth;

import com.whispers.api.web.ApiException;
import org.springframework.http.HttpStatus;

public class InvalidCredentialsException extends ApiException {

    public InvalidCredentialsException() {
        super(HttpStatus.BAD_REQUEST, "INVALID_CREDENTIALS", "Invalid credentials");
    }
}
