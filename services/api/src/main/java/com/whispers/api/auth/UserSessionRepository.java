package com.whispers.api.auth;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Modifying
    @Query("delete from UserSession s where s.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);

    @Transactional
    @Modifying
    @Query("delete from UserSession s where s.userId = :userId and s.expiresAt <= :now")
    int deleteExpired(@Param("userId") UUID userId, @Param("now") Instant now);
}
