package com.facilitydesk.backend.modules.auth.application;

import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.SessionRevocationReason;

/**
 * Bounded per-identity set of issued access tokens. Membership is what makes a token revocable before it expires.
 */
public interface SessionRegistry {

    /**
     * Records a token. When the identity then holds more than the configured maximum, the oldest entries are evicted.
     */
    void add(UUID userId, String token, SessionMetadata metadata);

    boolean contains(UUID userId, String token);

    /**
     * @return true when an active entry matched
     */
    boolean remove(UUID userId, String token);

    int clear(UUID userId, SessionRevocationReason reason);

    long activeCount(UUID userId);
}
