package com.facilitydesk.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required security settings are missing or out of range.
 * The {@code local} profile ships the development secrets and skips the check.
 */
@Component
@Profile("!local")
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_SECRET = "dev-jwt-secret-change-me-before-deploying-facilitydesk";
    static final String DEV_REFRESH_SECRET = "dev-jwt-refresh-secret-change-me-before-deploying-facilitydesk";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_ACCESS_TTL_MILLIS = 300_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 604_800_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
        }
        log.info("Environment configuration verified");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
                "spring.datasource.url",
                "jwt.secret",
                "jwt.refresh-secret",
                "jwt.expiration"
        };
        for (String var : requiredVars) {
            if (read(var).isEmpty()) {
                problems.add(var + " is missing");
            }
        }

        for (String secretKey : List.of("jwt.secret", "jwt.refresh-secret")) {
            read(secretKey).ifPresent(secret -> {
                if (DEV_SECRET.equals(secret) || DEV_REFRESH_SECRET.equals(secret)) {
                    problems.add(secretKey + " still uses the development default");
                }
                if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                    problems.add(secretKey + " must be at least " + MIN_SECRET_BYTES + " bytes");
                }
            });
        }
        Optional<String> accessSecret = read("jwt.secret");
        if (accessSecret.isPresent() && accessSecret.equals(read("jwt.refresh-secret"))) {
            problems.add("jwt.refresh-secret must differ from jwt.secret");
        }

        read("jwt.expiration").ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_ACCESS_TTL_MILLIS
                            + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        });

        read("facilitydesk.security.lockout.duration").ifPresent(raw -> {
            try {
                if (Duration.parse(raw).isNegative()) {
                    problems.add("facilitydesk.security.lockout.duration must not be negative");
                }
            } catch (DateTimeParseException e) {
                problems.add("facilitydesk.security.lockout.duration must be an ISO-8601 duration");
            }
        });

        return problems;
    }

    private Optional<String> read(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
