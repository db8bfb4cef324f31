package com.flagship.vn_accounting.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.journal.VoucherLineDetail;
import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.period.LockStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("voucher_id")
    UUID voucherId;

    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("is_balanced")
    boolean balanced;

    @JsonProperty("is_posted")
    boolean posted;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("is_locked")
    boolean locked;

    @JsonProperty("lock_status")
    LockStatus lockStatus;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("version")
    long version;

    @Value
    public static class Line {
        @JsonProperty("account_code")
        String accountCode;
        @JsonProperty("debit_amount")
        BigDecimal debitAmount;
        @JsonProperty("credit_amount")
        BigDecimal creditAmount;
        @JsonProperty("counterpart_account")
        String counterpartAccount;
        @JsonProperty("description")
        String description;
        @JsonProperty("object_code")
        String objectCode;
    }

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
                .id(entry.getId())
                .entryNumber(entry.getEntryNumber())
                .voucherId(entry.getVoucherId())
                .voucherDate(entry.getVoucherDate())
                .postingDate(entry.getPostingDate())
                .description(entry.getDescription())
                .lines(entry.getLines().stream().map(JournalEntryResponse::toLine).toList())
                .totalDebit(amountOf(entry.getTotalDebit()))
                .totalCredit(amountOf(entry.getTotalCredit()))
                .difference(amountOf(entry.getDifference()))
                .balanced(entry.isBalanced())
                .posted(entry.isPosted())
                .postedAt(entry.getPostedAt())
                .postedBy(entry.getPostedBy())
                .locked(entry.isLocked())
                .lockStatus(entry.getLockStatus())
                .createdBy(entry.getCreatedBy())
                .createdAt(entry.getCreatedAt())
                .version(entry.getVersion())
                .build();
    }

    private static Line toLine(VoucherLineDetail line) {
        return new Line(
            line.getAccountCode(),
            amountOf(line.getDebitAmount()),
            amountOf(line.getCreditAmount()),
            line.getCounterpartAccount(),
            line.getDescription(),
            line.getObjectCode()
        );
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }
}
