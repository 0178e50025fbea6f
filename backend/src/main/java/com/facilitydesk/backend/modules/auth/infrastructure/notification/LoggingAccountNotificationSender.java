package com.facilitydesk.backend.modules.auth.infrastructure.notification;

import com.facilitydesk.backend.modules.auth.application.AccountNotificationSender;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default sender used until a mail gateway is wired in. Records that a message would be sent; the token is never logged.
 */
@Component
public class LoggingAccountNotificationSender implements AccountNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccountNotificationSender.class);

    @Override
    public void sendEmailVerification(FacilityUser user, String token) {
        log.info("Email verification issued for user {} <{}>", user.getId(), user.getEmail());
    }

    @Override
    public void sendPasswordReset(FacilityUser user, String token) {
        log.info("Password reset issued for user {} <{}>", user.getId(), user.getEmail());
    }
}
