package com.whispers.api.security;

import com.whispers.api.web.ApiException;
import org.springframework.http.HttpStatus;

/**
 * The caller is authenticated but does not own the target. Reported as 401, the same status as
 * a missing session.
 */
public class UnauthorizedException extends ApiException {

    public UnauthorizedException() {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Unauthorized");
    }
}
