package com.facilitydesk.backend.modules.auth.application;

import com.facilitydesk.backend.modules.auth.domain.FacilityUser;

/**
 * Delivers single-use account tokens to their owner.
 */
public interface AccountNotificationSender {

    void sendEmailVerification(FacilityUser user, String token);

    void sendPasswordReset(FacilityUser user, String token);
}
