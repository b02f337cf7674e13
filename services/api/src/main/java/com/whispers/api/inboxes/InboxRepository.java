package com.whispers.api.inboxes;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InboxRepository extends JpaRepository<Inbox, UUID> {

    @Override
    @EntityGraph(attributePaths = "user")
    Optional<Inbox> findById(UUID id);

    @EntityGraph(attributePaths = "user")
    List<Inbox> findByUser_IdOrderByCreatedAtAsc(UUID userId);

    @Modifying
    @Query("delete from Inbox i where i.user.id = :userId")
    int deleteByOwner(@Param("userId") UUID userId);
}
