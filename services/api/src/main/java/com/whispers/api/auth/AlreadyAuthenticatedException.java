package com.whispers.api.auth;

import com.whispers.api.web.ApiException;
import org.springframework.http.HttpStatus;

public class AlreadyAuthenticatedException extends ApiException {

    public AlreadyAuthenticatedException() {
        super(HttpStatus.BAD_REQUEST, "ALREADY_AUTHENTICATED", "Already logged in");
    }
}
