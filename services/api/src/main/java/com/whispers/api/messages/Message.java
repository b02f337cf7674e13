package com.whispers.api.messages;

import com.whispers.api.inboxes.Inbox;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "messages")
public class Message {

    public static final int SUBJECT_MAX_LENGTH = 255;

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false, length = SUBJECT_MAX_LENGTH)
    String subject;

    @Lob
    @Column(nullable = false)
    String body;

    @Column(name = "is_read", nullable = false)
    boolean read;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "inbox_id", nullable = false, updatable = false)
    Inbox inbox;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    Instant updatedAt;

    protected Message() {}

    public Message(String subject, String body, Inbox inbox) {
        this.subject = subject;
        this.body = body;
        this.inbox = inbox;
        this.read = false;
    }

    public UUID getId() {
        return id;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public boolean isRead() {
        return read;
    }

    public Inbox getInbox() {
        return inbox;
    }

    public UUID getInboxId() {
        return inbox.getId();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
