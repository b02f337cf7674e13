package com.whispers.api.inboxes;

import com.whispers.api.web.ApiException;
import org.springframework.http.HttpStatus;

public class DuplicateNameException extends ApiException {

    public DuplicateNameException() {
        super(HttpStatus.BAD_REQUEST, "DUPLICATE_NAME", "Inbox already exists");
    }
}
