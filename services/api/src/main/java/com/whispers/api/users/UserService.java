package com.whispers.api.users;

import com.whispers.api.auth.CredentialService;
import com.whispers.api.auth.UserSessionRepository;
import com.whispers.api.inboxes.InboxRepository;
import com.whispers.api.messages.MessageRepository;
import com.whispers.api.security.Identity;
import com.whispers.api.security.OwnershipPolicy;
import com.whispers.api.web.NotFoundException;
import com.whispers.api.web.UniqueConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository users;
    private final InboxRepository inboxes;
    private final MessageRepository messages;
    private final UserSessionRepository sessions;
    private final CredentialService credentials;
    private final OwnershipPolicy policy;
    private final TransactionTemplate tx;

    UserService(UserRepository users, InboxRepository inboxes, MessageRepository messages,
            UserSessionRepository sessions, CredentialService credentials, OwnershipPolicy policy,
            TransactionTemplate tx) {
        this.users = users;
        this.inboxes = inboxes;
        this.messages = messages;
        this.sessions = sessions;
        this.credentials = credentials;
        this.policy = policy;
        this.tx = tx;
    }

    /**
     * Creates a user from an already validated request. A clash on the email's unique index is
     * reported as {@link DuplicateEmailException}, so concurrent sign-ups with one address leave
     * exactly one user behind.
     */
    public User create(NewUser req) {
        var hash = credentials.hash(req.password());
        User user;
        try {
            user = tx.execute(status -> users.saveAndFlush(new User(req.username(), req.email(), hash)));
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
        log.info("Created user id={}", user.getId());
        return user;
    }

    public User get(UUID id) {
        return users.findById(id).orElseThrow(() -> new NotFoundException("User not found"));
    }

    public User update(Identity caller, UUID id, UserChanges changes) {
        policy.authorizeUserChange(caller, id);
        var passwordHash = changes.password().map(credentials::hash);
        try {
            return tx.execute(status -> {
                var user = get(id);
                changes.username().ifPresent(v -> user.username = v);
                changes.email().ifPresent(v -> user.email = v);
                passwordHash.ifPresent(v -> user.passwordHash = v);
                return users.saveAndFlush(user);
            });
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
    }

    private static RuntimeException translate(DataIntegrityViolationException e) {
        return UniqueConstraints.isViolated(e, User.EMAIL_CONSTRAINT) ? new DuplicateEmailException() : e;
    }

    /**
     * Deletes a user together with its inboxes, their messages and the user's sessions. Children
     * go first so no row is left pointing at a removed parent.
     */
    public void delete(Identity caller, UUID id) {
        policy.authorizeUserChange(caller, id);
        tx.executeWithoutResult(status -> {
            var user = get(id);
            int removedMessages = messages.deleteByInboxOwner(id);
            int removedInboxes = inboxes.deleteByOwner(id);
            sessions.deleteByUserId(id);
            users.delete(user);
            log.info("Deleted user id={} inboxes={} messages={}", id, removedInboxes, removedMessages);
        });
    }
}
