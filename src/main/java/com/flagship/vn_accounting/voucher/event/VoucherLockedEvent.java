package com.flagship.vn_accounting.voucher.event;

import com.flagship.vn_accounting.voucher.AccountingVoucher;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class VoucherLockedEvent implements VoucherEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String lockStatus;
    String lockedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherLocked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VoucherLockedEvent from(AccountingVoucher voucher, String lockedBy) {
        return new VoucherLockedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getLockStatus().name(),
            lockedBy,
            Instant.now()
        );
    }
}
