package com.facilitydesk.backend.modules.user.presentation;

import java.net.URI;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.SecurityUtils;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.presentation.dto.MessageResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.facilitydesk.backend.modules.user.application.UserAdministrationService;
import com.facilitydesk.backend.modules.user.presentation.dto.AdminPasswordChangeRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.CreateUserRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateManagedFacilitiesRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdatePermissionsRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateUserRoleRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateUserStatusRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UserPageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserAdministrationService userAdministrationService;

    public UserController(UserAdministrationService userAdministrationService) {
        this.userAdministrationService = userAdministrationService;
    }

    @Operation(summary = "Create a user", description = "Managers create staff accounts; the account stays pending until email verification.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Email or username already taken"),
            @ApiResponse(responseCode = "403", description = "Manager role required or privileged role requested")
    })
    @PostMapping
    public ResponseEntity<UserProfileResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        UserProfileResponse response = userAdministrationService.createUser(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.created(URI.create("/users/" + response.id())).body(response);
    }

    @GetMapping
    public ResponseEntity<UserPageResponse<UserProfileResponse>> listUsers(
            @RequestParam(name = "role", required = false) String role,
            @RequestParam(name = "status", required = false) UserStatus status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(userAdministrationService.listUsers(
                SecurityUtils.getCurrentPrincipal(), role == null ? null : parseRole(role), status, search, page, limit));
    }

    @GetMapping("/role/{role}")
    public ResponseEntity<UserPageResponse<UserProfileResponse>> listUsersByRole(
            @PathVariable("role") String role,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(userAdministrationService.listUsers(
                SecurityUtils.getCurrentPrincipal(), parseRole(role), null, null, page, limit));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAdministrationService.getUser(SecurityUtils.getCurrentPrincipal(), userId));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> updateUser(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updateUser(SecurityUtils.getCurrentPrincipal(), userId, request));
    }

    @Operation(summary = "Soft-delete a user", description = "Deactivates the account and revokes its sessions.")
    @DeleteMapping("/{userId}")
    public ResponseEntity<MessageResponse> deleteUser(@PathVariable("userId") UUID userId) {
        userAdministrationService.deleteUser(SecurityUtils.getCurrentPrincipal(), userId);
        return ResponseEntity.ok(MessageResponse.of("User deleted successfully"));
    }

    @PatchMapping("/{userId}/restore")
    public ResponseEntity<UserProfileResponse> restoreUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAdministrationService.restoreUser(SecurityUtils.getCurrentPrincipal(), userId));
    }

    @PatchMapping("/{userId}/status")
    public ResponseEntity<UserProfileResponse> updateStatus(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updateStatus(SecurityUtils.getCurrentPrincipal(), userId, request.status()));
    }

    @Operation(summary = "Change a user's role", description = "Capabilities are recomputed for the new role; explicit overrides are kept.")
    @PatchMapping("/{userId}/role")
    public ResponseEntity<UserProfileResponse> updateRole(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserRoleRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updateRole(SecurityUtils.getCurrentPrincipal(), userId, request.role()));
    }

    @PatchMapping("/{userId}/permissions")
    public ResponseEntity<UserProfileResponse> updatePermissions(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdatePermissionsRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updatePermissions(SecurityUtils.getCurrentPrincipal(), userId, request));
    }

    @PutMapping("/{userId}/managed-facilities")
    public ResponseEntity<UserProfileResponse> updateManagedFacilities(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateManagedFacilitiesRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updateManagedFacilities(SecurityUtils.getCurrentPrincipal(), userId, request));
    }

    @PatchMapping("/{userId}/password")
    public ResponseEntity<MessageResponse> changePassword(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody AdminPasswordChangeRequest request
    ) {
        userAdministrationService.changePassword(SecurityUtils.getCurrentPrincipal(), userId, request);
        return ResponseEntity.ok(MessageResponse.of("Password updated successfully"));
    }

    private UserRole parseRole(String role) {
        try {
            return UserRole.from(role);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.invalid_role", "Invalid role value");
        }
    }
}
