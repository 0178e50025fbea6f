package com.facilitydesk.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.facilitydesk.backend.modules.auth.domain.AccountSecurity;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.LockoutState;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Consecutive failed-login counter with a fixed lock window.
 * An elapsed lock stops rejecting logins but the counter stays until the next successful login.
 */
@Component
public class AccountLockoutPolicy {

    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockDuration;

    public AccountLockoutPolicy(
            Clock clock,
            @Value("${facilitydesk.security.lockout.max-attempts:5}") int maxAttempts,
            @Value("${facilitydesk.security.lockout.duration:PT30M}") Duration lockDuration
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("lockout max-attempts must be positive");
        }
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.lockDuration = lockDuration;
    }

    public LockoutState stateOf(FacilityUser user) {
        AccountSecurity security = user.getSecurity();
        if (isLocked(user)) {
            return new LockoutState.Locked(security.getLockoutUntil());
        }
        return new LockoutState.Unlocked(security.getFailedLoginAttempts());
    }

    public LockoutState recordFailure(FacilityUser user) {
        AccountSecurity security = user.getSecurity();
        int failCount = security.getFailedLoginAttempts() + 1;
        security.setFailedLoginAttempts(failCount);
        if (failCount >= maxAttempts) {
            OffsetDateTime until = now().plus(lockDuration);
            security.setLockoutUntil(until);
            return new LockoutState.Locked(until);
        }
        return new LockoutState.Unlocked(failCount);
    }

    public LockoutState recordSuccess(FacilityUser user) {
        AccountSecurity security = user.getSecurity();
        security.setFailedLoginAttempts(0);
        security.setLockoutUntil(null);
        return new LockoutState.Unlocked(0);
    }

    public boolean isLocked(FacilityUser user) {
        return isLocked(user, now());
    }

    public boolean isLocked(FacilityUser user, OffsetDateTime at) {
        OffsetDateTime until = user.getSecurity().getLockoutUntil();
        return until != null && until.isAfter(at);
    }

    /**
     * Whole minutes until the lock lifts, rounded up. Zero when not locked.
     */
    public long remainingMinutes(FacilityUser user) {
        OffsetDateTime until = user.getSecurity().getLockoutUntil();
        OffsetDateTime now = now();
        if (until == null || !until.isAfter(now)) {
            return 0;
        }
        long millis = Duration.between(now, until).toMillis();
        return Math.max(1, (millis + 59_999) / 60_000);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
