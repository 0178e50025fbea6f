package com.facilitydesk.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.facilitydesk.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByResourceKeyOrderByCreatedAtAsc(String resourceKey);
}
