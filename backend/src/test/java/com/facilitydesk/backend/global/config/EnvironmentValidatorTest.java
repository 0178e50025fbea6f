package com.facilitydesk.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/facilitydesk")
                .withProperty("jwt.secret", "prod-access-secret-with-enough-entropy-0001")
                .withProperty("jwt.refresh-secret", "prod-refresh-secret-with-enough-entropy-0001")
                .withProperty("jwt.expiration", "86400000")
                .withProperty("facilitydesk.security.lockout.duration", "PT30M");
    }

    @Test
    void acceptsCompleteConfiguration() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.validate()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void reportsMissingSettings() {
        environment.setProperty("jwt.secret", "  ");
        environment.setProperty("spring.datasource.url", "");

        assertThat(new EnvironmentValidator(environment).validate())
                .contains("jwt.secret is missing", "spring.datasource.url is missing");
    }

    @Test
    void rejectsWeakAndDefaultSecrets() {
        environment.setProperty("jwt.secret", "short");
        environment.setProperty("jwt.refresh-secret", EnvironmentValidator.DEV_SECRET);

        assertThat(new EnvironmentValidator(environment).validate())
                .contains("jwt.secret must be at least 32 bytes", "jwt.refresh-secret still uses the development default");
    }

    @Test
    void rejectsSharedAndLocalRefreshSecrets() {
        environment.setProperty("jwt.refresh-secret", "prod-access-secret-with-enough-entropy-0001");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("jwt.refresh-secret must differ from jwt.secret");

        environment.setProperty("jwt.refresh-secret", EnvironmentValidator.DEV_REFRESH_SECRET);

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("jwt.refresh-secret still uses the development default");
    }

    @Test
    void rejectsOutOfRangeExpiryAndBadLockoutDuration() {
        environment.setProperty("jwt.expiration", "1000");
        environment.setProperty("facilitydesk.security.lockout.duration", "thirty minutes");

        assertThat(new EnvironmentValidator(environment).validate())
                .hasSize(2)
                .anyMatch(problem -> problem.startsWith("jwt.expiration must be between"))
                .contains("facilitydesk.security.lockout.duration must be an ISO-8601 duration");
    }

    @Test
    void failsStartupWhenInvalid() {
        environment.setProperty("jwt.expiration", "not-a-number");

        assertThatThrownBy(new EnvironmentValidator(environment)::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be numeric");
    }
}
