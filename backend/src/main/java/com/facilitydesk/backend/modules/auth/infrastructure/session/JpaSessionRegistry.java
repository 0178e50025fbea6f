package com.facilitydesk.backend.modules.auth.infrastructure.session;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.application.CredentialStore;
import com.facilitydesk.backend.modules.auth.application.SessionMetadata;
import com.facilitydesk.backend.modules.auth.application.SessionRegistry;
import com.facilitydesk.backend.modules.auth.domain.SessionRevocationReason;
import com.facilitydesk.backend.modules.auth.domain.UserSession;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session registry over the {@code user_session} table. Only the SHA-256 of a token is stored.
 * Eviction reads then writes without locking, so concurrent logins can briefly leave more than the maximum.
 */
@Component
@Transactional
public class JpaSessionRegistry implements SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionRegistry.class);
    private static final int DEVICE_MAX_LENGTH = 255;
    private static final int IP_MAX_LENGTH = 64;

    private final UserSessionRepository userSessionRepository;
    private final CredentialStore credentialStore;
    private final Clock clock;
    private final int maxSessions;
    private final Duration sessionTtl;

    public JpaSessionRegistry(
            UserSessionRepository userSessionRepository,
            CredentialStore credentialStore,
            Clock clock,
            @Value("${facilitydesk.security.sessions.max-per-user:5}") int maxSessions,
            @Value("${facilitydesk.security.sessions.ttl:P7D}") Duration sessionTtl
    ) {
        this.userSessionRepository = userSessionRepository;
        this.credentialStore = credentialStore;
        this.clock = clock;
        this.maxSessions = maxSessions;
        this.sessionTtl = sessionTtl;
    }

    /**
     * The identity's revoked and expired rows are dropped first; rows beyond the maximum are deleted oldest first.
     */
    @Override
    public void add(UUID userId, String token, SessionMetadata metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        SessionMetadata safeMetadata = metadata != null ? metadata : SessionMetadata.unknown();
        userSessionRepository.deleteInactiveForUser(userId, now);

        UserSession session = new UserSession();
        session.setUserId(userId);
        session.setTokenHash(credentialStore.hashToken(token));
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(sessionTtl));
        session.setDevice(truncate(safeMetadata.device(), DEVICE_MAX_LENGTH));
        session.setIpAddress(truncate(safeMetadata.ipAddress(), IP_MAX_LENGTH));
        userSessionRepository.saveAndFlush(session);

        List<UserSession> active = userSessionRepository.findActiveSessions(userId, now);
        int overflow = active.size() - maxSessions;
        if (overflow > 0) {
            userSessionRepository.deleteAllInBatch(active.subList(0, overflow));
            log.debug("Evicted {} oldest session(s) for user {}", overflow, userId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean contains(UUID userId, String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findByUserIdAndTokenHash(userId, credentialStore.hashToken(token))
                .map(session -> session.isActiveAt(now))
                .orElse(false);
    }

    @Override
    public boolean remove(UUID userId, String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findByUserIdAndTokenHash(userId, credentialStore.hashToken(token))
                .filter(session -> session.isActiveAt(now))
                .map(session -> {
                    session.revoke(now, SessionRevocationReason.LOGOUT);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public int clear(UUID userId, SessionRevocationReason reason) {
        return userSessionRepository.revokeAllForUser(userId, OffsetDateTime.now(clock), reason.name());
    }

    @Override
    @Transactional(readOnly = true)
    public long activeCount(UUID userId) {
        return userSessionRepository.countActiveSessions(userId, OffsetDateTime.now(clock));
    }

    /**
     * Deletes every revoked or expired row across all identities.
     */
    public int purgeInactive() {
        return userSessionRepository.deleteInactive(OffsetDateTime.now(clock));
    }

    private String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
