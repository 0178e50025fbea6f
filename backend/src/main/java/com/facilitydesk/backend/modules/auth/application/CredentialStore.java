package com.facilitydesk.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;

import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.VerificationTokenKind;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Password hashing, single-use token handling and the normalization step every identity write goes through.
 */
@Component
public class CredentialStore {

    private static final int TOKEN_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final PasswordEncoder passwordEncoder;
    private final PermissionResolver permissionResolver;
    private final FacilityUserRepository facilityUserRepository;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialStore(
            PasswordEncoder passwordEncoder,
            PermissionResolver permissionResolver,
            FacilityUserRepository facilityUserRepository,
            Clock clock
    ) {
        this.passwordEncoder = passwordEncoder;
        this.permissionResolver = permissionResolver;
        this.facilityUserRepository = facilityUserRepository;
        this.clock = clock;
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Returns false for a null input or a hash the encoder cannot parse.
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Stores the hash and expiry of a fresh random token on the identity and returns the plaintext.
     * The caller must commit the identity before handing the token out.
     */
    public String issueVerificationToken(FacilityUser user, VerificationTokenKind kind) {
        byte[] raw = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(raw);
        String plaintext = HEX.formatHex(raw);
        user.setVerificationToken(kind, hashToken(plaintext), now().plus(kind.validity()));
        return plaintext;
    }

    public boolean consumeVerificationToken(FacilityUser user, VerificationTokenKind kind, String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            return false;
        }
        String storedHash = user.getVerificationTokenHash(kind);
        OffsetDateTime expiresAt = user.getVerificationTokenExpiresAt(kind);
        if (storedHash == null || expiresAt == null) {
            return false;
        }
        boolean matches = MessageDigest.isEqual(
                storedHash.getBytes(StandardCharsets.US_ASCII),
                hashToken(plaintext).getBytes(StandardCharsets.US_ASCII));
        if (!matches || !expiresAt.isAfter(now())) {
            return false;
        }
        user.clearVerificationToken(kind);
        return true;
    }

    public String hashToken(String plaintext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Hashes a staged password and, for new identities or after a role change, recomputes effective capabilities.
     */
    public FacilityUser prepareForPersist(FacilityUser user) {
        String pending = user.getPendingPassword();
        if (pending != null) {
            user.setPasswordHash(hash(pending));
            user.getSecurity().setLastPasswordChange(now());
            user.clearPendingPassword();
        }
        if (user.getId() == null || user.isRoleChanged()) {
            applyCapabilities(user);
            user.clearRoleChanged();
        }
        return user;
    }

    public void applyCapabilities(FacilityUser user) {
        CapabilitySet effective = permissionResolver.resolve(user);
        user.replaceGrantedCapabilities(effective.granted());
        user.replaceCustomPermissions(effective.customPermissions());
    }

    public FacilityUser commit(FacilityUser user) {
        return facilityUserRepository.saveAndFlush(prepareForPersist(user));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
