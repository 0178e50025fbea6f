package com.facilitydesk.backend.modules.auth.infrastructure.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "facilitydesk.security.sessions.purge-enabled", havingValue = "true", matchIfMissing = true)
public class SessionPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionPurgeScheduler.class);

    private final JpaSessionRegistry sessionRegistry;

    public SessionPurgeScheduler(JpaSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Scheduled(
            fixedDelayString = "${facilitydesk.security.sessions.purge-interval:PT1H}",
            initialDelayString = "${facilitydesk.security.sessions.purge-interval:PT1H}"
    )
    public void purgeInactiveSessions() {
        int purged = sessionRegistry.purgeInactive();
        if (purged > 0) {
            log.info("Purged {} revoked or expired sessions", purged);
        }
    }
}
