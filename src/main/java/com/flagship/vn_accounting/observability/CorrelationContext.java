package com.flagship.vn_accounting.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread correlation id and MDC keys used in log lines.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String VOUCHER_ID_MDC_KEY = "voucherId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current id, generating one if none was set on this thread.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(VOUCHER_ID_MDC_KEY);
        MDC.remove(ENTRY_ID_MDC_KEY);
    }

    /**
     * Short form for readable log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
