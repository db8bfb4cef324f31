package com.flagship.vn_accounting.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit trail filter. Null fields are not filtered on; {@code to} is exclusive.
 */
@Value
@Builder
public class AuditQuery {
    String entityType;
    UUID entityId;
    String userId;
    AuditAction action;
    Instant from;
    Instant to;
}
