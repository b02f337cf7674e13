package com.whispers.api.users;

import com.whispers.api.web.ApiException;
import org.springframework.http.HttpStatus;

public class DuplicateEmailException extends ApiException {

    public DuplicateEmailException() {
        super(HttpStatus.BAD_REQUEST, "DUPLICATE_EMAIL", "Email already exists");
    }
}
