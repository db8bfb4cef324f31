package com.flagship.vn_accounting.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for the voucher and posting use cases.
 *
 * <ul>
 *   <li>{@code accounting.vouchers.created} tagged by voucher type and outcome</li>
 *   <li>{@code accounting.vouchers.signed}, {@code accounting.vouchers.locked}</li>
 *   <li>{@code accounting.entries.posted} tagged by outcome</li>
 *   <li>{@code accounting.latency} tagged by operation</li>
 *   <li>{@code idempotency.cache} hit/miss</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class AccountingMetrics {

    private final MeterRegistry registry;

    public void recordVoucherCreated(String voucherType, String status) {
        registry.counter("accounting.vouchers.created",
                "voucher_type", sanitizeTag(voucherType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordVoucherSigned() {
        registry.counter("accounting.vouchers.signed").increment();
    }

    public void recordVoucherLocked(String lockStatus) {
        registry.counter("accounting.vouchers.locked", "lock_status", sanitizeTag(lockStatus)).increment();
    }

    public void recordEntryPosted(String status) {
        registry.counter("accounting.entries.posted", "status", sanitizeTag(status)).increment();
    }

    public void recordPeriodLocked(String periodType) {
        registry.counter("accounting.periods.locked", "period_type", sanitizeTag(periodType)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("accounting.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
