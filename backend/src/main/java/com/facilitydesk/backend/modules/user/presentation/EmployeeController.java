package com.facilitydesk.backend.modules.user.presentation;

import java.util.UUID;

import com.facilitydesk.backend.global.security.SecurityUtils;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.presentation.dto.MessageResponse;
import com.facilitydesk.backend.modules.user.application.EmployeeLifecycleService;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeExitDetailsResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeSummaryResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.TerminateEmployeeRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UserPageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/employees")
public class EmployeeController {

    private final EmployeeLifecycleService employeeLifecycleService;

    public EmployeeController(EmployeeLifecycleService employeeLifecycleService) {
        this.employeeLifecycleService = employeeLifecycleService;
    }

    @Operation(summary = "Terminate an employee", description = "Deactivates and soft-deletes the account and revokes its sessions.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Terminated"),
            @ApiResponse(responseCode = "400", description = "Exit date in the future"),
            @ApiResponse(responseCode = "404", description = "Employee not found")
    })
    @PostMapping("/{employeeId}/terminate")
    public ResponseEntity<MessageResponse> terminate(
            @PathVariable("employeeId") UUID employeeId,
            @Valid @RequestBody TerminateEmployeeRequest request
    ) {
        employeeLifecycleService.terminate(SecurityUtils.getCurrentPrincipal(), employeeId, request);
        return ResponseEntity.ok(MessageResponse.of("Employee terminated successfully"));
    }

    @PostMapping("/{employeeId}/confirm")
    public ResponseEntity<EmployeeSummaryResponse> confirm(@PathVariable("employeeId") UUID employeeId) {
        return ResponseEntity.ok(employeeLifecycleService.confirm(SecurityUtils.getCurrentPrincipal(), employeeId));
    }

    @Operation(summary = "List employees of a facility", description = "Requires manager role and access to the facility.")
    @GetMapping("/facility/{facilityId}")
    public ResponseEntity<UserPageResponse<EmployeeSummaryResponse>> listByFacility(
            @PathVariable("facilityId") UUID facilityId,
            @RequestParam(name = "role", required = false) UserRole role,
            @RequestParam(name = "status", required = false) UserStatus status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(employeeLifecycleService.listByFacility(
                SecurityUtils.getCurrentPrincipal(), facilityId, role, status, page, limit));
    }

    @GetMapping("/{employeeId}/exit-details")
    public ResponseEntity<EmployeeExitDetailsResponse> exitDetails(@PathVariable("employeeId") UUID employeeId) {
        return ResponseEntity.ok(employeeLifecycleService.exitDetails(SecurityUtils.getCurrentPrincipal(), employeeId));
    }
}
