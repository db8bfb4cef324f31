package com.flagship.vn_accounting.journal.event;

import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.journal.VoucherLineDetail;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published when a journal entry is committed to the ledger.
 * Carries the lines so consumers can update their own balances.
 */
@Value
public class JournalEntryPostedEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    UUID voucherId;
    LocalDate postingDate;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    List<Line> lines;
    String postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";
    public static final String AGGREGATE_TYPE = "JournalEntry";

    public String getEventType() {
        return EVENT_TYPE;
    }

    @Value
    public static class Line {
        String accountCode;
        BigDecimal debitAmount;
        BigDecimal creditAmount;
    }

    public static JournalEntryPostedEvent from(JournalEntry entry) {
        List<Line> lines = entry.getLines().stream()
                .map(JournalEntryPostedEvent::toLine)
                .toList();
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getVoucherId(),
            entry.getPostingDate(),
            entry.getTotalDebit().getAmount(),
            entry.getTotalCredit().getAmount(),
            lines,
            entry.getPostedBy(),
            Instant.now()
        );
    }

    private static Line toLine(VoucherLineDetail line) {
        return new Line(
            line.getAccountCode(),
            line.getDebitAmount() != null ? line.getDebitAmount().getAmount() : null,
            line.getCreditAmount() != null ? line.getCreditAmount().getAmount() : null
        );
    }
}
