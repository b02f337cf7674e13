package com.whispers.api.messages;

import com.whispers.api.security.Identity;
import com.whispers.api.web.Validation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
class MessageController {

    private final MessageService messages;

    MessageController(MessageService messages) {
        this.messages = messages;
    }

    @GetMapping("/inboxes/{inboxId}/messages")
    List<MessageView> list(@PathVariable UUID inboxId, @AuthenticationPrincipal Identity caller) {
        return messages.listForInbox(caller, inboxId).stream().map(MessageView::of).toList();
    }

    @PostMapping("/inboxes/{inboxId}/messages")
    ResponseEntity<MessageView> create(@PathVariable UUID inboxId,
            @RequestBody(required = false) MessageRequest req) {
        Validation.requireBody(req);
        var body = Validation.requireNonEmpty(req.body(), "Body is required");
        var subject = req.subject() == null ? "" : req.subject().trim();
        Validation.requireMaxLength(subject, Message.SUBJECT_MAX_LENGTH, "Subject");
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(MessageView.of(messages.create(inboxId, subject, body)));
    }

    @GetMapping("/messages/{id}")
    MessageView get(@PathVariable UUID id, @AuthenticationPrincipal Identity caller) {
        return MessageView.of(messages.get(caller, id));
    }

    @PutMapping("/messages/{id}")
    MessageView update(@PathVariable UUID id, @RequestBody(required = false) MessageUpdateRequest req,
            @AuthenticationPrincipal Identity caller) {
        return MessageView.of(messages.update(caller, id, MessageChanges.from(req)));
    }

    @DeleteMapping("/messages/{id}")
    ResponseEntity<Void> delete(@PathVariable UUID id, @AuthenticationPrincipal Identity caller) {
        messages.delete(caller, id);
        return ResponseEntity.noContent().build();
    }
}
