package com.facilitydesk.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.LastModifiedBy;

/**
 * Account identity: credentials, role, permission flags, security counters and soft-delete state.
 */
@Entity
@Table(name = "facility_user")
public class FacilityUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "username", length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "phone", length = 30)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private UserStatus status = UserStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 16)
    private VerificationStatus verificationStatus = VerificationStatus.PENDING;

    @ElementCollection
    @CollectionTable(name = "user_capability", joinColumns = @JoinColumn(name = "user_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "capability", nullable = false, length = 40)
    private Set<Capability> grantedCapabilities = new HashSet<>();

    @ElementCollection
    @CollectionTable(name = "user_permission_override", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "capability", length = 40)
    @Column(name = "granted", nullable = false)
    private Map<Capability, Boolean> permissionOverrides = new EnumMap<>(Capability.class);

    @ElementCollection
    @CollectionTable(name = "user_custom_permission", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    @Column(name = "permission", nullable = false, length = 100)
    private List<String> customPermissions = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "user_managed_facility", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "facility_id", nullable = false, columnDefinition = "uuid")
    private Set<UUID> managedFacilities = new HashSet<>();

    @Embedded
    private AccountSecurity security = new AccountSecurity();

    @Embedded
    private EmployeeProfile employeeProfile = new EmployeeProfile();

    @Column(name = "email_verification_token_hash", length = 64)
    private String emailVerificationTokenHash;

    @Column(name = "email_verification_expires_at")
    private OffsetDateTime emailVerificationExpiresAt;

    @Column(name = "password_reset_token_hash", length = 64)
    private String passwordResetTokenHash;

    @Column(name = "password_reset_expires_at")
    private OffsetDateTime passwordResetExpiresAt;

    @CreatedBy
    @Column(name = "created_by", updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @LastModifiedBy
    @Column(name = "updated_by", columnDefinition = "uuid")
    private UUID updatedBy;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Column(name = "deleted_by", columnDefinition = "uuid")
    private UUID deletedBy;

    @Transient
    private String pendingPassword;

    @Transient
    private boolean roleChanged;

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username == null || username.isBlank() ? null : username.trim();
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        if (this.role != null && this.role != role) {
            this.roleChanged = true;
        }
        this.role = role;
    }

    public boolean isRoleChanged() {
        return roleChanged;
    }

    public void clearRoleChanged() {
        this.roleChanged = false;
    }

    public UserStatus getStatus() {
        return status;
    }

    public void setStatus(UserStatus status) {
        this.status = status;
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public void setVerificationStatus(VerificationStatus verificationStatus) {
        this.verificationStatus = verificationStatus;
    }

    public Set<Capability> getGrantedCapabilities() {
        return grantedCapabilities;
    }

    public void replaceGrantedCapabilities(Set<Capability> capabilities) {
        grantedCapabilities.clear();
        grantedCapabilities.addAll(capabilities);
    }

    public Map<Capability, Boolean> getPermissionOverrides() {
        return permissionOverrides;
    }

    public List<String> getCustomPermissions() {
        return customPermissions;
    }

    public void replaceCustomPermissions(List<String> permissions) {
        customPermissions.clear();
        customPermissions.addAll(permissions);
    }

    public Set<UUID> getManagedFacilities() {
        return managedFacilities;
    }

    public CapabilitySet capabilities() {
        Set<Capability> granted = grantedCapabilities.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(grantedCapabilities);
        return new CapabilitySet(granted, new ArrayList<>(customPermissions));
    }

    public AccountSecurity getSecurity() {
        if (security == null) {
            security = new AccountSecurity();
        }
        return security;
    }

    public EmployeeProfile getEmployeeProfile() {
        if (employeeProfile == null) {
            employeeProfile = new EmployeeProfile();
        }
        return employeeProfile;
    }

    public String getEmailVerificationTokenHash() {
        return emailVerificationTokenHash;
    }

    public OffsetDateTime getEmailVerificationExpiresAt() {
        return emailVerificationExpiresAt;
    }

    public String getPasswordResetTokenHash() {
        return passwordResetTokenHash;
    }

    public OffsetDateTime getPasswordResetExpiresAt() {
        return passwordResetExpiresAt;
    }

    public String getVerificationTokenHash(VerificationTokenKind kind) {
        return switch (kind) {
            case EMAIL_VERIFICATION -> emailVerificationTokenHash;
            case PASSWORD_RESET -> passwordResetTokenHash;
        };
    }

    public OffsetDateTime getVerificationTokenExpiresAt(VerificationTokenKind kind) {
        return switch (kind) {
            case EMAIL_VERIFICATION -> emailVerificationExpiresAt;
            case PASSWORD_RESET -> passwordResetExpiresAt;
        };
    }

    public void setVerificationToken(VerificationTokenKind kind, String tokenHash, OffsetDateTime expiresAt) {
        switch (kind) {
            case EMAIL_VERIFICATION -> {
                this.emailVerificationTokenHash = tokenHash;
                this.emailVerificationExpiresAt = expiresAt;
            }
            case PASSWORD_RESET -> {
                this.passwordResetTokenHash = tokenHash;
                this.passwordResetExpiresAt = expiresAt;
            }
        }
    }

    public void clearVerificationToken(VerificationTokenKind kind) {
        setVerificationToken(kind, null, null);
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public UUID getDeletedBy() {
        return deletedBy;
    }

    public void markDeleted(OffsetDateTime at, UUID by) {
        this.deleted = true;
        this.deletedAt = at;
        this.deletedBy = by;
    }

    public void restore() {
        this.deleted = false;
        this.deletedAt = null;
        this.deletedBy = null;
    }

    /**
     * Stages a new plaintext password; it is hashed by the credential write path before the entity is saved.
     */
    public void changePassword(String plaintext) {
        this.pendingPassword = plaintext;
    }

    public String getPendingPassword() {
        return pendingPassword;
    }

    public void clearPendingPassword() {
        this.pendingPassword = null;
    }
}
