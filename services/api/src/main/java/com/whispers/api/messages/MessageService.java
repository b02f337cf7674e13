package com.whispers.api.messages;

import com.whispers.api.inboxes.InboxService;
import com.whispers.api.security.Identity;
import com.whispers.api.security.OwnershipPolicy;
import com.whispers.api.web.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Messages are dropped into an inbox by anyone who knows its id; reading, marking and deleting
 * them is reserved to the inbox's owner.
 */
@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageRepository messages;
    private final InboxService inboxes;
    private final OwnershipPolicy policy;
    private final TransactionTemplate tx;

    MessageService(MessageRepository messages, InboxService inboxes, OwnershipPolicy policy, TransactionTemplate tx) {
        this.messages = messages;
        this.inboxes = inboxes;
        this.policy = policy;
        this.tx = tx;
    }

    public Message create(UUID inboxId, String subject, String body) {
        var created = tx.execute(status -> {
            var inbox = inboxes.find(inboxId);
            return messages.saveAndFlush(new Message(subject, body, inbox));
        });
        log.info("Created message id={} inbox={}", created.getId(), inboxId);
        return created;
    }

    public List<Message> listForInbox(Identity caller, UUID inboxId) {
        policy.requireIdentity(caller);
        return tx.execute(status -> {
            policy.authorize(caller, inboxes.find(inboxId));
            return messages.findByInbox_IdOrderByCreatedAtDesc(inboxId);
        });
    }

    public Message get(Identity caller, UUID id) {
        policy.requireIdentity(caller);
        var message = find(id);
        policy.authorize(caller, message);
        return message;
    }

    public Message update(Identity caller, UUID id, MessageChanges changes) {
        policy.requireIdentity(caller);
        return tx.execute(status -> {
            var message = find(id);
            policy.authorize(caller, message);
            changes.read().ifPresent(v -> message.read = v);
            return messages.saveAndFlush(message);
        });
    }

    public void delete(Identity caller, UUID id) {
        policy.requireIdentity(caller);
        tx.executeWithoutResult(status -> {
            var message = find(id);
            policy.authorize(caller, message);
            messages.delete(message);
            log.info("Deleted message id={}", id);
        });
    }

    private Message find(UUID id) {
        return messages.findById(id).orElseThrow(() -> new NotFoundException("Message not found"));
    }
}
