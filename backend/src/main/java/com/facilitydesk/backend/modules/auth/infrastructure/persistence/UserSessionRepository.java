package com.facilitydesk.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    Optional<UserSession> findByUserIdAndTokenHash(UUID userId, String tokenHash);

    @Query("""
            select us
              from UserSession us
             where us.userId = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
             order by us.id asc
            """)
    List<UserSession> findActiveSessions(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("""
            select count(us)
              from UserSession us
             where us.userId = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
            """)
    long countActiveSessions(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.userId = :userId
               and us.revokedAt is null
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("revokedAt") OffsetDateTime revokedAt,
                         @Param("reason") String reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from UserSession us
             where us.userId = :userId
               and (us.revokedAt is not null or us.expiresAt <= :now)
            """)
    int deleteInactiveForUser(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from UserSession us
             where us.revokedAt is not null
                or us.expiresAt <= :now
            """)
    int deleteInactive(@Param("now") OffsetDateTime now);
}
