package com.facilitydesk.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * The container starts once per JVM; Flyway migrates it when the first context loads.
 * Every test ends with all tables truncated.
 */
@ActiveProfiles("test")
public abstract class AbstractPostgresIntegrationTest {

    private static final Object CONTAINER_LOCK = new Object();
    private static PostgreSQLContainer<?> postgres;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        PostgreSQLContainer<?> container = container();
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
    }

    private static PostgreSQLContainer<?> container() {
        synchronized (CONTAINER_LOCK) {
            if (postgres == null) {
                postgres = new PostgreSQLContainer<>("postgres:16.4")
                        .withDatabaseName("facilitydesk_test")
                        .withUsername("facilitydesk")
                        .withPassword("facilitydesk");
                postgres.start();
            }
            return postgres;
        }
    }

    @AfterEach
    void truncateTables() {
        PostgreSQLContainer<?> container = container();
        try (Connection connection = DriverManager.getConnection(
                container.getJdbcUrl(),
                container.getUsername(),
                container.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE audit_log, user_session, user_managed_facility, user_custom_permission,
                                   user_permission_override, user_capability, facility_user
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset tables after test", ex);
        }
    }
}
