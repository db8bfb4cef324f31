package com.flagship.vn_accounting.audit;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID>, JpaSpecificationExecutor<AuditLogEntity> {

    List<AuditLogEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(String entityType, UUID entityId);

    static Specification<AuditLogEntity> hasEntityType(String entityType) {
        return (root, query, cb) -> cb.equal(root.get("entityType"), entityType);
    }

    static Specification<AuditLogEntity> hasEntityId(UUID entityId) {
        return (root, query, cb) -> cb.equal(root.get("entityId"), entityId);
    }

    static Specification<AuditLogEntity> hasUserId(String userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    static Specification<AuditLogEntity> hasAction(AuditAction action) {
        return (root, query, cb) -> cb.equal(root.get("action"), action);
    }

    static Specification<AuditLogEntity> createdFrom(Instant from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    static Specification<AuditLogEntity> createdBefore(Instant to) {
        return (root, query, cb) -> cb.lessThan(root.get("createdAt"), to);
    }
}
