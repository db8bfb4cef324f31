package com.flagship.vn_accounting.voucher.event;

import com.flagship.vn_accounting.voucher.AccountingVoucher;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class VoucherSignedEvent implements VoucherEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String signerId;
    Instant signedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherSigned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VoucherSignedEvent from(AccountingVoucher voucher) {
        return new VoucherSignedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getSignerId(),
            voucher.getSignedAt(),
            Instant.now()
        );
    }
}
