package com.flagship.vn_accounting.exception;

/**
 * Thrown when a use case tries to change a locked voucher or journal entry.
 */
public class EntityLockedException extends AccountingException {

    private final String entityType;
    private final String reference;

    public EntityLockedException(String entityType, String reference, String lockStatus) {
        super("ENTITY_LOCKED",
                String.format("%s %s is locked (%s) and cannot be modified", entityType, reference, lockStatus));
        this.entityType = entityType;
        this.reference = reference;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getReference() {
        return reference;
    }
}
