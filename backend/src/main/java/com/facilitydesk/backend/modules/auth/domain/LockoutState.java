package com.facilitydesk.backend.modules.auth.domain;

import java.time.OffsetDateTime;

public sealed interface LockoutState permits LockoutState.Unlocked, LockoutState.Locked {

    record Unlocked(int failCount) implements LockoutState {
    }

    record Locked(OffsetDateTime until) implements LockoutState {
    }
}
