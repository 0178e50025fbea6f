package com.facilitydesk.backend.modules.user.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Seeds the first super-admin at startup when {@code facilitydesk.bootstrap.super-admin.enabled} is set.
 */
@Component
public class SuperAdminProvisioner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SuperAdminProvisioner.class);

    private final IdentityProvisioningService provisioningService;
    private final boolean enabled;
    private final String email;
    private final String username;
    private final String password;
    private final String firstName;
    private final String lastName;

    public SuperAdminProvisioner(
            IdentityProvisioningService provisioningService,
            @Value("${facilitydesk.bootstrap.super-admin.enabled:false}") boolean enabled,
            @Value("${facilitydesk.bootstrap.super-admin.email:}") String email,
            @Value("${facilitydesk.bootstrap.super-admin.username:}") String username,
            @Value("${facilitydesk.bootstrap.super-admin.password:}") String password,
            @Value("${facilitydesk.bootstrap.super-admin.first-name:Super}") String firstName,
            @Value("${facilitydesk.bootstrap.super-admin.last-name:Admin}") String lastName
    ) {
        this.provisioningService = provisioningService;
        this.enabled = enabled;
        this.email = email;
        this.username = username;
        this.password = password;
        this.firstName = firstName;
        this.lastName = lastName;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            return;
        }
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            log.warn("Super admin bootstrap enabled but email or password is missing; skipping");
            return;
        }
        if (provisioningService.superAdminExists()) {
            log.info("Super admin already exists; bootstrap skipped");
            return;
        }
        provisioningService.createSuperAdmin(new IdentityProvisioningService.SuperAdminCommand(
                email, StringUtils.hasText(username) ? username : null, password, firstName, lastName));
    }
}
