package com.facilitydesk.backend.modules.auth;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.security.test.web.servlet.response.SecurityMockMvcResultMatchers.unauthenticated;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.support.AbstractPostgresIntegrationTest;
import com.facilitydesk.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final UUID FACILITY_ID = UUID.fromString("00000000-0000-0000-0000-00000000f301");
    private static final String MANAGER_EMAIL = "manager@example.com";
    private static final String TECHNICIAN_EMAIL = "tech@example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureUser(MANAGER_EMAIL, UserRole.FACILITY_MANAGER, Set.of(FACILITY_ID));
        testUserFactory.ensureUser(TECHNICIAN_EMAIL, UserRole.TECHNICIAN, Set.of(FACILITY_ID));
    }

    @Test
    void loginReturnsTokensAndProfileIsReadableWithThem() throws Exception {
        String accessToken = accessTokenFor(MANAGER_EMAIL);

        mockMvc.perform(get("/auth/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(MANAGER_EMAIL))
                .andExpect(jsonPath("$.role").value("FACILITY_MANAGER"))
                .andExpect(jsonPath("$.permissions.canManageEmployees").value(true))
                .andExpect(jsonPath("$.managedFacilities[0]").value(FACILITY_ID.toString()));
    }

    @Test
    void protectedEndpointsRequireBearerToken() throws Exception {
        mockMvc.perform(get("/auth/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTHENTICATION_REQUIRED"));

        mockMvc.perform(get("/auth/profile").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID"));
    }

    @Test
    void sessionEndpointNeverRejects() throws Exception {
        mockMvc.perform(get("/auth/session").with(anonymous()))
                .andExpect(status().isOk())
                .andExpect(unauthenticated())
                .andExpect(jsonPath("$.authenticated").value(false));

        mockMvc.perform(get("/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false));

        String accessToken = accessTokenFor(TECHNICIAN_EMAIL);
        mockMvc.perform(get("/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.email").value(TECHNICIAN_EMAIL))
                .andExpect(jsonPath("$.role").value("TECHNICIAN"));
    }

    @Test
    void lockedAccountTokensAreRefusedWithLocked() throws Exception {
        String accessToken = accessTokenFor(TECHNICIAN_EMAIL);
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "email": "%s",
                                      "password": "wrong-password"
                                    }
                                    """.formatted(TECHNICIAN_EMAIL)))
                    .andExpect(status().isUnauthorized());
        }

        mockMvc.perform(get("/auth/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isLocked())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(unauthenticated())
                .andExpect(jsonPath("$.code").value("ACCOUNT_LOCKED"));
    }

    @Test
    void logoutInvalidatesTheToken() throws Exception {
        String accessToken = accessTokenFor(TECHNICIAN_EMAIL);

        mockMvc.perform(post("/auth/logout").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logged out successfully"));

        mockMvc.perform(get("/auth/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_INVALIDATED"));
    }

    @Test
    void loginValidationAndCredentialFailures() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "password": "whatever"
                                }
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "%s",
                                  "password": "wrong-password"
                                }
                                """.formatted(TECHNICIAN_EMAIL)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/auth/session").header("X-Request-Id", "trace-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-42"));

        mockMvc.perform(get("/auth/session"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void userCreationIsLimitedToManagers() throws Exception {
        String body = """
                {
                  "email": "new.hire@example.com",
                  "password": "Init1al-password",
                  "firstName": "New",
                  "lastName": "Hire",
                  "role": "HOUSEKEEPING"
                }
                """;

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessTokenFor(TECHNICIAN_EMAIL))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PERMISSION"));

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessTokenFor(MANAGER_EMAIL))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(header().exists(HttpHeaders.LOCATION))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.managedFacilities[0]").value(FACILITY_ID.toString()));
    }

    @Test
    void unknownRoleFilterIsRejected() throws Exception {
        mockMvc.perform(get("/users/role/bogus")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessTokenFor(MANAGER_EMAIL)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("user.invalid_role"));
    }

    @Test
    void managedFacilityIdsMustNotContainNull() throws Exception {
        mockMvc.perform(put("/users/{userId}/managed-facilities", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessTokenFor(MANAGER_EMAIL))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "facilityIds": [null]
                                }
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void managerListsFacilityEmployees() throws Exception {
        String managerToken = accessTokenFor(MANAGER_EMAIL);

        mockMvc.perform(get("/employees/facility/{facilityId}", FACILITY_ID)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + managerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].email").value(TECHNICIAN_EMAIL));

        mockMvc.perform(get("/employees/facility/{facilityId}", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + managerToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FACILITY_ACCESS_DENIED"));
    }

    private String accessTokenFor(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "%s",
                                  "password": "%s",
                                  "device": "junit"
                                }
                                """.formatted(email, TestUserFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.tokens.refreshToken").isNotEmpty())
                .andExpect(jsonPath("$.user.email").value(email))
                .andReturn();

        JsonNode response = objectMapper.readTree(result.getResponse().getContentAsString());
        return response.path("tokens").path("accessToken").asText();
    }
}
