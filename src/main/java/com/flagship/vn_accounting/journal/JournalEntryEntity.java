package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.period.LockStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a journal entry and its lines.
 *
 * Lines and totals are fixed at creation; posting and locking fields are the
 * only updatable state.
 */
@Entity
@Table(
    name = "journal_entries",
    indexes = {
        @Index(name = "idx_journal_entries_voucher", columnList = "voucher_id"),
        @Index(name = "idx_journal_entries_date", columnList = "company_code, voucher_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entry_number", nullable = false, updatable = false, unique = true, length = 50)
    private String entryNumber;

    @Column(name = "voucher_id", nullable = false, updatable = false)
    private UUID voucherId;

    @Column(name = "company_code", nullable = false, updatable = false, length = 20)
    private String companyCode;

    @Column(name = "voucher_date", nullable = false, updatable = false)
    private LocalDate voucherDate;

    @Column(name = "posting_date", nullable = false, updatable = false)
    private LocalDate postingDate;

    @Column(nullable = false, updatable = false, length = 500)
    private String description;

    @Column(name = "description_detail", updatable = false, columnDefinition = "TEXT")
    private String descriptionDetail;

    @Column(name = "total_debit", updatable = false, precision = 19, scale = 4)
    private BigDecimal totalDebit;

    @Column(name = "total_credit", updatable = false, precision = 19, scale = 4)
    private BigDecimal totalCredit;

    @Column(updatable = false, precision = 19, scale = 4)
    private BigDecimal difference;

    @Column(name = "is_posted", nullable = false)
    private boolean posted;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "posted_by", length = 100)
    private String postedBy;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_status", nullable = false, length = 20)
    private LockStatus lockStatus;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "journalEntry", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<JournalEntryLineEntity> lines = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static JournalEntryEntity fromDomain(JournalEntry entry) {
        JournalEntryEntity entity = new JournalEntryEntity();
        entity.id = entry.getId();
        entity.entryNumber = entry.getEntryNumber();
        entity.voucherId = entry.getVoucherId();
        entity.companyCode = entry.getCompanyCode();
        entity.voucherDate = entry.getVoucherDate();
        entity.postingDate = entry.getPostingDate();
        entity.description = entry.getDescription();
        entity.descriptionDetail = entry.getDescriptionDetail();
        entity.totalDebit = amountOf(entry.getTotalDebit());
        entity.totalCredit = amountOf(entry.getTotalCredit());
        entity.difference = amountOf(entry.getDifference());
        entity.createdBy = entry.getCreatedBy();
        entity.copyMutableState(entry);

        int lineNumber = 1;
        for (VoucherLineDetail line : entry.getLines()) {
            entity.lines.add(JournalEntryLineEntity.fromDomain(entity, lineNumber++, line));
        }
        return entity;
    }

    public JournalEntry toDomain() {
        return JournalEntry.builder()
                .id(id)
                .entryNumber(entryNumber)
                .voucherId(voucherId)
                .companyCode(companyCode)
                .voucherDate(voucherDate)
                .postingDate(postingDate)
                .description(description)
                .descriptionDetail(descriptionDetail)
                .lines(lines.stream().map(JournalEntryLineEntity::toDomain).toList())
                .totalDebit(moneyOf(totalDebit))
                .totalCredit(moneyOf(totalCredit))
                .difference(moneyOf(difference))
                .posted(posted)
                .postedAt(postedAt)
                .postedBy(postedBy)
                .locked(locked)
                .lockStatus(lockStatus)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .version(version != null ? version + 1 : 1)
                .build();
    }

    void updateFromDomain(JournalEntry entry) {
        copyMutableState(entry);
    }

    private void copyMutableState(JournalEntry entry) {
        this.posted = entry.isPosted();
        this.postedAt = entry.getPostedAt();
        this.postedBy = entry.getPostedBy();
        this.locked = entry.isLocked();
        this.lockStatus = entry.getLockStatus();
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }

    private static Money moneyOf(BigDecimal amount) {
        return amount != null ? Money.vnd(amount) : null;
    }
}
