package com.whispers.api.inboxes;

import com.whispers.api.web.Validation;
import com.whispers.api.web.ValidationException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

record InboxRequest(String name) {}

/** Partial update of an inbox; the name is the only attribute a client may change. */
record InboxChanges(Optional<String> name) {

    static InboxChanges from(InboxRequest request) {
        Validation.requireBody(request);
        if (request.name() == null) {
            throw new ValidationException("No fields to update");
        }
        return new InboxChanges(Optional.of(checkName(request.name())));
    }

    static String checkName(String name) {
        return Validation.requireMaxLength(Validation.requireText(name, "Name is required"),
                Inbox.NAME_MAX_LENGTH, "Name");
    }
}

record InboxView(UUID id, String name, UUID userId, String url, Instant createdAt, Instant updatedAt) {

    static InboxView of(Inbox inbox) {
        return new InboxView(inbox.getId(), inbox.getName(), inbox.getOwnerId(), inbox.getUrl(),
                inbox.getCreatedAt(), inbox.getUpdatedAt());
    }
}
