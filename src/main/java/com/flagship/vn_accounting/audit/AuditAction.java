package com.flagship.vn_accounting.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    SIGN,
    LOCK,
    POST
}
