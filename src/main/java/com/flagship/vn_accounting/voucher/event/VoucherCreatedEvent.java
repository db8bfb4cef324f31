package com.flagship.vn_accounting.voucher.event;

import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.voucher.AccountingVoucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class VoucherCreatedEvent implements VoucherEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    LocalDate voucherDate;
    String companyCode;
    UUID journalEntryId;
    String entryNumber;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VoucherCreatedEvent from(AccountingVoucher voucher, JournalEntry entry) {
        return new VoucherCreatedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().name(),
            voucher.getVoucherDate(),
            voucher.getCompanyCode(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getTotalDebit().getAmount(),
            entry.getTotalCredit().getAmount(),
            voucher.getCreatedBy(),
            Instant.now()
        );
    }
}
