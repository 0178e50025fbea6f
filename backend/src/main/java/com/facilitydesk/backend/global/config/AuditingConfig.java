package com.facilitydesk.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Audit timestamps and lockout, session and token expiry all read the same UTC clock.
 */
@Configuration
@EnableJpaAuditing(auditorAwareRef = "facilityDeskAuditorAware", dateTimeProviderRef = "clockDateTimeProvider")
public class AuditingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock.withZone(ZoneOffset.UTC)));
    }
}
