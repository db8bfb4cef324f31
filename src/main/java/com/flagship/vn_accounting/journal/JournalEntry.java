package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.exception.AlreadyPostedException;
import com.flagship.vn_accounting.exception.JournalEntryNotBalancedException;
import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.period.LockStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Double-entry posting unit (Appendix III).
 *
 * Lifecycle: unbalanced, then balanced once totals are computed from the lines,
 * then posted. Locking is orthogonal and can happen in any state.
 * Every transition returns a new instance with version + 1.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    String entryNumber;
    UUID voucherId;
    String companyCode;
    LocalDate voucherDate;
    LocalDate postingDate;
    String description;
    String descriptionDetail;
    @Singular
    List<VoucherLineDetail> lines;
    Money totalDebit;
    Money totalCredit;
    Money difference;
    boolean posted;
    Instant postedAt;
    String postedBy;
    boolean locked;
    LockStatus lockStatus;
    String createdBy;
    Instant createdAt;
    long version;

    /**
     * Creates an open, unposted entry with totals already computed from the lines.
     */
    public static JournalEntry create(String entryNumber, UUID voucherId, String companyCode,
                                      LocalDate voucherDate, LocalDate postingDate,
                                      String description, List<VoucherLineDetail> lines,
                                      String createdBy) {
        return JournalEntry.builder()
                .id(UUID.randomUUID())
                .entryNumber(entryNumber)
                .voucherId(voucherId)
                .companyCode(companyCode)
                .voucherDate(voucherDate)
                .postingDate(postingDate != null ? postingDate : voucherDate)
                .description(description)
                .lines(lines != null ? lines : List.of())
                .lockStatus(LockStatus.OPEN)
                .createdBy(createdBy)
                .createdAt(Instant.now())
                .version(1)
                .build()
                .calculateTotals();
    }

    /**
     * Sums debit and credit amounts across all lines. Absent amounts count as zero.
     *
     * @throws com.flagship.vn_accounting.exception.CurrencyMismatchException if a line is not in VND
     */
    public JournalEntry calculateTotals() {
        Money debit = Money.zero(Money.VND);
        Money credit = Money.zero(Money.VND);
        for (VoucherLineDetail line : lines) {
            if (line.getDebitAmount() != null) {
                debit = debit.add(line.getDebitAmount());
            }
            if (line.getCreditAmount() != null) {
                credit = credit.add(line.getCreditAmount());
            }
        }
        return toBuilder()
                .totalDebit(debit)
                .totalCredit(credit)
                .difference(debit.subtract(credit))
                .build();
    }

    /**
     * Exact decimal comparison; 100.00 and 100 are equal.
     */
    public boolean isBalanced() {
        return totalDebit != null && totalCredit != null && totalDebit.isSameAmountAs(totalCredit);
    }

    /**
     * @throws JournalEntryNotBalancedException if debit != credit
     * @throws AlreadyPostedException if this entry was posted before
     */
    public JournalEntry post(String postedBy) {
        if (!isBalanced()) {
            throw new JournalEntryNotBalancedException(entryNumber, amountOf(totalDebit), amountOf(totalCredit));
        }
        if (posted) {
            throw new AlreadyPostedException(entryNumber);
        }
        return toBuilder()
                .posted(true)
                .postedAt(Instant.now())
                .postedBy(postedBy)
                .version(version + 1)
                .build();
    }

    /**
     * Never fails: period-end locking freezes entries regardless of their state.
     */
    public JournalEntry lock(LockStatus lockStatus) {
        return toBuilder()
                .locked(true)
                .lockStatus(lockStatus)
                .version(version + 1)
                .build();
    }

    public boolean canModify() {
        return !locked;
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }
}
