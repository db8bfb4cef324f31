package com.flagship.vn_accounting.voucher.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of voucher lifecycle events. The voucher id is the Kafka key.
 */
public interface VoucherEvent {

    String AGGREGATE_TYPE = "Voucher";

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getVoucherId();

    String getVoucherNumber();

    Instant getOccurredAt();

    String getEventType();
}
