package com.whispers.api.messages;

import com.whispers.api.web.Validation;
import com.whispers.api.web.ValidationException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

record MessageRequest(String subject, String body) {}

record MessageUpdateRequest(Boolean read) {}

/** Partial update of a message. Received content is immutable; only the read flag changes. */
record MessageChanges(Optional<Boolean> read) {

    static MessageChanges from(MessageUpdateRequest request) {
        Validation.requireBody(request);
        if (request.read() == null) {
            throw new ValidationException("No fields to update");
        }
        return new MessageChanges(Optional.of(request.read()));
    }
}

record MessageView(UUID id, String subject, String body, boolean read, UUID inboxId, Instant createdAt,
        Instant updatedAt) {

    static MessageView of(Message message) {
        return new MessageView(message.getId(), message.getSubject(), message.getBody(), message.isRead(),
                message.getInboxId(), message.getCreatedAt(), message.getUpdatedAt());
    }
}
