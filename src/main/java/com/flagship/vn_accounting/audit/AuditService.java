package com.flagship.vn_accounting.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vn_accounting.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes the audit trail (Article 6).
 *
 * Records are written in the caller's transaction, so an audit row exists
 * exactly when the state change it describes has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must be called within an existing transaction.
     *
     * @param oldValue snapshot before the change, serialized to JSON; may be null
     * @param newValue snapshot after the change, serialized to JSON; may be null
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLog record(String userId, AuditAction action, String entityType, UUID entityId,
                           Object oldValue, Object newValue) {
        String correlationId = CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null;
        AuditLog auditLog = AuditLog.create(userId, action, entityType, entityId,
                serialize(oldValue), serialize(newValue), correlationId);

        repository.save(AuditLogEntity.fromDomain(auditLog));
        log.debug("Audit: user={}, action={}, entityType={}, entityId={}", userId, action, entityType, entityId);
        return auditLog;
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> search(AuditQuery query, int page, int size) {
        Specification<AuditLogEntity> spec = Specification.where(null);
        if (query.getEntityType() != null) {
            spec = spec.and(AuditLogRepository.hasEntityType(query.getEntityType()));
        }
        if (query.getEntityId() != null) {
            spec = spec.and(AuditLogRepository.hasEntityId(query.getEntityId()));
        }
        if (query.getUserId() != null) {
            spec = spec.and(AuditLogRepository.hasUserId(query.getUserId()));
        }
        if (query.getAction() != null) {
            spec = spec.and(AuditLogRepository.hasAction(query.getAction()));
        }
        if (query.getFrom() != null) {
            spec = spec.and(AuditLogRepository.createdFrom(query.getFrom()));
        }
        if (query.getTo() != null) {
            spec = spec.and(AuditLogRepository.createdBefore(query.getTo()));
        }
        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return repository.findAll(spec, pageRequest).map(AuditLogEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> historyOf(String entityType, UUID entityId) {
        return repository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId)
                .stream()
                .map(AuditLogEntity::toDomain)
                .toList();
    }

    private String serialize(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit snapshot", e);
        }
    }
}
