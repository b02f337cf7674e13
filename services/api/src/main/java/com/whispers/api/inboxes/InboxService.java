package com.whispers.api.inboxes;

import com.whispers.api.messages.MessageRepository;
import com.whispers.api.security.Identity;
import com.whispers.api.security.OwnershipPolicy;
import com.whispers.api.users.UserService;
import com.whispers.api.web.NotFoundException;
import com.whispers.api.web.UniqueConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

@Service
public class InboxService {

    private static final Logger log = LoggerFactory.getLogger(InboxService.class);

    private final InboxRepository inboxes;
    private final MessageRepository messages;
    private final UserService users;
    private final InboxUrls urls;
    private final OwnershipPolicy policy;
    private final TransactionTemplate tx;

    InboxService(InboxRepository inboxes, MessageRepository messages, UserService users, InboxUrls urls,
            OwnershipPolicy policy, TransactionTemplate tx) {
        this.inboxes = inboxes;
        this.messages = messages;
        this.users = users;
        this.urls = urls;
        this.policy = policy;
        this.tx = tx;
    }

    /**
     * Creates an inbox for an existing user. The row and its derived URL are written in the same
     * transaction; a name the owner already uses fails with {@link DuplicateNameException}.
     */
    public Inbox create(UUID userId, String name) {
        Inbox created;
        try {
            created = tx.execute(status -> {
                var owner = users.get(userId);
                var inbox = inboxes.save(new Inbox(name, owner));
                inbox.url = urls.urlFor(inbox.id);
                return inboxes.saveAndFlush(inbox);
            });
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
        log.info("Created inbox id={} user={}", created.getId(), userId);
        return created;
    }

    public List<Inbox> listForUser(UUID userId) {
        return tx.execute(status -> {
            users.get(userId);
            return inboxes.findByUser_IdOrderByCreatedAtAsc(userId);
        });
    }

    /** Loads an inbox without any ownership check. */
    public Inbox find(UUID id) {
        return inboxes.findById(id).orElseThrow(() -> new NotFoundException("Inbox not found"));
    }

    public Inbox get(Identity caller, UUID id) {
        policy.requireIdentity(caller);
        var inbox = find(id);
        policy.authorize(caller, inbox);
        return inbox;
    }

    public Inbox update(Identity caller, UUID id, InboxChanges changes) {
        policy.requireIdentity(caller);
        try {
            return tx.execute(status -> {
                var inbox = find(id);
                policy.authorize(caller, inbox);
                changes.name().ifPresent(v -> inbox.name = v);
                return inboxes.saveAndFlush(inbox);
            });
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
    }

    private static RuntimeException translate(DataIntegrityViolationException e) {
        return UniqueConstraints.isViolated(e, Inbox.NAME_CONSTRAINT) ? new DuplicateNameException() : e;
    }

    public void delete(Identity caller, UUID id) {
        policy.requireIdentity(caller);
        tx.executeWithoutResult(status -> {
            var inbox = find(id);
            policy.authorize(caller, inbox);
            int removed = messages.deleteByInboxId(id);
            inboxes.delete(inbox);
            log.info("Deleted inbox id={} messages={}", id, removed);
        });
    }
}
