package com.flagship.vn_accounting.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One audit trail record. Old and new values are JSON snapshots, either may be null.
 */
@Value
public class AuditLog {
    UUID id;
    String userId;
    AuditAction action;
    String entityType;
    UUID entityId;
    String oldValue;
    String newValue;
    String correlationId;
    Instant createdAt;

    public static AuditLog create(String userId, AuditAction action, String entityType, UUID entityId,
                                  String oldValue, String newValue, String correlationId) {
        return new AuditLog(UUID.randomUUID(), userId, action, entityType, entityId,
                oldValue, newValue, correlationId, Instant.now());
    }
}
