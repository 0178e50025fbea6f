package com.facilitydesk.backend.modules.auth.presentation;

import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.global.security.SecurityUtils;
import com.facilitydesk.backend.modules.auth.application.AuthService;
import com.facilitydesk.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.MessageResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.RefreshRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.SessionStatusResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Log in", description = "Authenticates by email or username and opens a session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tokens and profile"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "Account not active or not verified"),
            @ApiResponse(responseCode = "423", description = "Account locked")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT)));
    }

    @Operation(summary = "Refresh access token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair"),
            @ApiResponse(responseCode = "401", description = "Refresh token invalid or expired")
    })
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request, httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT)));
    }

    @Operation(summary = "Log out the current session")
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout() {
        authService.logout(SecurityUtils.getCurrentPrincipal());
        return ResponseEntity.ok(MessageResponse.of("Logged out successfully"));
    }

    @Operation(summary = "Log out every session of the current user")
    @PostMapping("/logout-all")
    public ResponseEntity<MessageResponse> logoutAll() {
        authService.logoutAll(SecurityUtils.getCurrentPrincipal());
        return ResponseEntity.ok(MessageResponse.of("Logged out from all devices"));
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> profile() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Describe the caller", description = "Never rejects; anonymous callers get authenticated=false.")
    @GetMapping("/session")
    public ResponseEntity<SessionStatusResponse> session() {
        SessionStatusResponse response = SecurityUtils.findCurrentPrincipal()
                .map(principal -> new SessionStatusResponse(true, principal.userId(), principal.email(), principal.role().name()))
                .orElseGet(SessionStatusResponse::anonymous);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Change own password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Current password incorrect")
    })
    @PutMapping("/change-password")
    public ResponseEntity<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        authService.changePassword(principal, request);
        return ResponseEntity.ok(MessageResponse.of("Password changed successfully"));
    }

    @PostMapping("/verify-email/{token}")
    public ResponseEntity<MessageResponse> verifyEmail(@PathVariable("token") String token) {
        authService.verifyEmail(token);
        return ResponseEntity.ok(MessageResponse.of("Email verified successfully"));
    }

    @Operation(summary = "Request a password reset", description = "Always answers with the same message.")
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(authService.forgotPassword(request));
    }

    @Operation(summary = "Reset password with a single-use token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password reset; all sessions revoked"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired token")
    })
    @PostMapping("/reset-password/{token}")
    public ResponseEntity<MessageResponse> resetPassword(
            @PathVariable("token") String token,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        authService.resetPassword(token, request);
        return ResponseEntity.ok(MessageResponse.of("Password reset successfully"));
    }
}
