package com.facilitydesk.backend.modules.user.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.modules.auth.application.AuthFailure;
import com.facilitydesk.backend.modules.auth.application.AuthFailureException;
import com.facilitydesk.backend.modules.auth.application.AuthService;
import com.facilitydesk.backend.modules.auth.application.SessionRegistry;
import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.EmploymentStatus;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.CreateUserRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeExitDetailsResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeSummaryResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.TerminateEmployeeRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UserPageResponse;
import com.facilitydesk.backend.support.AbstractPostgresIntegrationTest;
import com.facilitydesk.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class EmployeeLifecycleServiceTest extends AbstractPostgresIntegrationTest {

    private static final UUID FACILITY_ID = UUID.fromString("00000000-0000-0000-0000-00000000f201");
    private static final UUID OTHER_FACILITY_ID = UUID.fromString("00000000-0000-0000-0000-00000000f202");

    @Autowired
    EmployeeLifecycleService employeeLifecycleService;

    @Autowired
    UserAdministrationService userAdministrationService;

    @Autowired
    AuthService authService;

    @Autowired
    SessionRegistry sessionRegistry;

    @Autowired
    TestUserFactory testUserFactory;

    private AuthenticatedPrincipal manager;
    private AuthenticatedPrincipal supervisor;
    private FacilityUser technician;

    @BeforeEach
    void setUp() {
        manager = principalOf(testUserFactory.ensureUser("manager@example.com", UserRole.FACILITY_MANAGER, Set.of(FACILITY_ID)));
        supervisor = principalOf(testUserFactory.ensureUser("supervisor@example.com", UserRole.SUPERVISOR, Set.of(FACILITY_ID)));
        technician = testUserFactory.ensureUser("tech@example.com", UserRole.TECHNICIAN, Set.of(FACILITY_ID));
        testUserFactory.ensureUser("admin@example.com", UserRole.ADMIN, Set.of(FACILITY_ID));
        testUserFactory.ensureUser("elsewhere@example.com", UserRole.TECHNICIAN, Set.of(OTHER_FACILITY_ID));
    }

    @Test
    @DisplayName("termination deactivates, hides and signs out the employee")
    void terminateEndsEmployment() {
        String accessToken = authService.login(
                new LoginRequest("tech@example.com", null, TestUserFactory.DEFAULT_PASSWORD, null, null), "127.0.0.1", "JUnit")
                .tokens().accessToken();
        LocalDate exitDate = LocalDate.now().minusDays(1);

        employeeLifecycleService.terminate(supervisor, technician.getId(), new TerminateEmployeeRequest(exitDate, " Contract ended "));

        assertThat(sessionRegistry.contains(technician.getId(), accessToken)).isFalse();
        ProblemException login = assertThrows(ProblemException.class, () -> authService.login(
                new LoginRequest("tech@example.com", null, TestUserFactory.DEFAULT_PASSWORD, null, null), "127.0.0.1", "JUnit"));
        assertThat(login.getCode()).isEqualTo("INVALID_CREDENTIALS");

        EmployeeExitDetailsResponse details = employeeLifecycleService.exitDetails(manager, technician.getId());
        assertThat(details.terminationDate()).isEqualTo(exitDate);
        assertThat(details.lastWorkingDay()).isEqualTo(exitDate);
        assertThat(details.exitReason()).isEqualTo("Contract ended");
        assertThat(details.employmentStatus()).isEqualTo(EmploymentStatus.TERMINATED);
        assertThat(details.deleted()).isTrue();
        assertThat(details.deletedBy()).isEqualTo(supervisor.userId());
    }

    @Test
    void terminationRulesAndGates() {
        ProblemException future = assertThrows(ProblemException.class, () -> employeeLifecycleService.terminate(
                supervisor, technician.getId(), new TerminateEmployeeRequest(LocalDate.now().plusDays(2), "Moving")));
        assertThat(future.getCode()).isEqualTo("employee.exit_date_in_future");

        AuthFailureException denied = assertThrows(AuthFailureException.class, () -> employeeLifecycleService.terminate(
                principalOf(technician), technician.getId(), new TerminateEmployeeRequest(LocalDate.now(), "Quit")));
        assertThat(denied.getFailure()).isEqualTo(AuthFailure.INSUFFICIENT_PERMISSION);

        ProblemException missing = assertThrows(ProblemException.class, () -> employeeLifecycleService.terminate(
                supervisor, UUID.randomUUID(), new TerminateEmployeeRequest(LocalDate.now(), "Quit")));
        assertThat(missing.getCode()).isEqualTo("employee.not_found");
    }

    @Test
    void exitDetailsRequireATerminatedEmployee() {
        ProblemException notTerminated = assertThrows(ProblemException.class,
                () -> employeeLifecycleService.exitDetails(manager, technician.getId()));
        assertThat(notTerminated.getCode()).isEqualTo("employee.not_terminated");
    }

    @Test
    @DisplayName("exit details need the employee reports capability on top of the manager tier")
    void exitDetailsRequireEmployeeReportsCapability() {
        AuthenticatedPrincipal withoutReports = new AuthenticatedPrincipal(manager.userId(), manager.email(), manager.role(),
                CapabilitySet.none(), manager.managedFacilities(), "unused");

        AuthFailureException denied = assertThrows(AuthFailureException.class,
                () -> employeeLifecycleService.exitDetails(withoutReports, technician.getId()));

        assertThat(denied.getFailure()).isEqualTo(AuthFailure.INSUFFICIENT_PERMISSION);
    }

    @Test
    @DisplayName("confirming a probationer ends probation")
    void confirmEndsProbation() {
        CreateUserRequest request = new CreateUserRequest("probation@example.com", null, "Init1al-password", "Pro", "Bation",
                null, UserRole.HOUSEKEEPING, null, "Housekeeping", "Attendant", LocalDate.now(), LocalDate.now().plusMonths(3));
        UUID id = userAdministrationService.createUser(manager, request).id();

        EmployeeSummaryResponse confirmed = employeeLifecycleService.confirm(manager, id);

        assertThat(confirmed.employmentStatus()).isEqualTo(EmploymentStatus.ACTIVE);
        assertThrows(AuthFailureException.class, () -> employeeLifecycleService.confirm(supervisor, id));
    }

    @Test
    @DisplayName("facility listing excludes the caller, admin-tier accounts and other facilities")
    void listByFacility() {
        UserPageResponse<EmployeeSummaryResponse> page = employeeLifecycleService.listByFacility(manager, FACILITY_ID, null, null, null, null);

        assertThat(page.items())
                .extracting(EmployeeSummaryResponse::email)
                .containsExactlyInAnyOrder("supervisor@example.com", "tech@example.com");

        UserPageResponse<EmployeeSummaryResponse> technicians = employeeLifecycleService.listByFacility(
                manager, FACILITY_ID, UserRole.TECHNICIAN, UserStatus.ACTIVE, 1, 10);
        assertThat(technicians.items()).extracting(EmployeeSummaryResponse::email).containsExactly("tech@example.com");

        AuthFailureException denied = assertThrows(AuthFailureException.class,
                () -> employeeLifecycleService.listByFacility(manager, OTHER_FACILITY_ID, null, null, null, null));
        assertThat(denied.getFailure()).isEqualTo(AuthFailure.FACILITY_ACCESS_DENIED);
    }

    private AuthenticatedPrincipal principalOf(FacilityUser user) {
        return new AuthenticatedPrincipal(user.getId(), user.getEmail(), user.getRole(), user.capabilities(),
                Set.copyOf(user.getManagedFacilities()), "unused");
    }
}
