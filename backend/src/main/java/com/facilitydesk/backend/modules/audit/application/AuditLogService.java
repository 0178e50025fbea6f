package com.facilitydesk.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.facilitydesk.backend.modules.audit.domain.AuditAction;
import com.facilitydesk.backend.modules.audit.domain.AuditLog;
import com.facilitydesk.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    static final String RESOURCE_USER = "USER";
    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.action().name());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setRequestId(MDC.get(REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    /**
     * Shorthand for events about an identity.
     */
    public void recordUserEvent(AuditAction action, UUID subjectUserId, UUID actorUserId, Map<String, Object> detail) {
        record(new AuditLogCommand(action, RESOURCE_USER, String.valueOf(subjectUserId), actorUserId, detail));
    }

    public record AuditLogCommand(
            AuditAction action,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            Map<String, Object> detail
    ) {
    }
}
