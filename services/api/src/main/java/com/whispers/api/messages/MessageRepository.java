package com.whispers.api.messages;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    @Override
    @EntityGraph(attributePaths = {"inbox", "inbox.user"})
    Optional<Message> findById(UUID id);

    @EntityGraph(attributePaths = "inbox")
    List<Message> findByInbox_IdOrderByCreatedAtDesc(UUID inboxId);

    @Modifying
    @Query("delete from Message m where m.inbox.id = :inboxId")
    int deleteByInboxId(@Param("inboxId") UUID inboxId);

    @Modifying
    @Query("delete from Message m where m.inbox.id in (select i.id from Inbox i where i.user.id = :userId)")
    int deleteByInboxOwner(@Param("userId") UUID userId);
}
