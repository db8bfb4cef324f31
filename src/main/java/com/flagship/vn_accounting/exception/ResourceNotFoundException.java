package com.flagship.vn_accounting.exception;

/**
 * Thrown when a voucher, journal entry or account cannot be found.
 */
public class ResourceNotFoundException extends AccountingException {

    private final String resourceType;
    private final String reference;

    public ResourceNotFoundException(String resourceType, Object reference) {
        super("NOT_FOUND", String.format("%s not found: %s", resourceType, reference));
        this.resourceType = resourceType;
        this.reference = String.valueOf(reference);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getReference() {
        return reference;
    }
}
