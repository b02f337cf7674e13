package com.whispers.api.security;

import com.whispers.api.inboxes.Inbox;
import com.whispers.api.messages.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Ownership rules for the User → Inbox → Message chain.
 *
 * <p>An identity may act on an inbox only when it is the inbox's owner. Messages carry no owner of
 * their own and are checked through the inbox that holds them. Changes to user records are open to
 * any caller unless {@code app.users.requireSelf} is set, in which case only the user themself may
 * change or delete their record.
 */
@Component
public class OwnershipPolicy {

    private static final Logger log = LoggerFactory.getLogger(OwnershipPolicy.class);

    private final boolean requireSelf;

    OwnershipPolicy(@Value("${app.users.requireSelf:false}") boolean requireSelf) {
        this.requireSelf = requireSelf;
    }

    public Identity requireIdentity(Identity identity) {
        if (identity == null) {
            throw new UnauthenticatedException("Authentication required");
        }
        return identity;
    }

    public boolean permits(Identity identity, Inbox inbox) {
        return identity != null && inbox.getOwnerId().equals(identity.userId());
    }

    public void authorize(Identity identity, Inbox inbox) {
        requireIdentity(identity);
        if (!permits(identity, inbox)) {
            log.warn("Denied user={} access to inbox={}", identity.userId(), inbox.getId());
            throw new UnauthorizedException();
        }
    }

    public void authorize(Identity identity, Message message) {
        authorize(identity, message.getInbox());
    }

    public void authorizeUserChange(Identity identity, UUID userId) {
        if (!requireSelf) {
            return;
        }
        requireIdentity(identity);
        if (!identity.userId().equals(userId)) {
            log.warn("Denied user={} changes to user={}", identity.userId(), userId);
            throw new UnauthorizedException();
        }
    }
}
