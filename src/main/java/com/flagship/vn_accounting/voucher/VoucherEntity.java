package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.period.LockStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for an accounting voucher.
 *
 * The idempotency key is a persistence concern and is passed separately
 * to {@link #fromDomain(AccountingVoucher, String)}.
 * Only signing and locking fields are updatable.
 */
@Entity
@Table(
    name = "vouchers",
    indexes = {
        @Index(name = "idx_vouchers_date", columnList = "company_code, voucher_date"),
        @Index(name = "idx_vouchers_type", columnList = "voucher_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VoucherEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "voucher_number", nullable = false, updatable = false, unique = true, length = 50)
    private String voucherNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "voucher_type", nullable = false, updatable = false, length = 30)
    private VoucherType voucherType;

    @Column(name = "voucher_date", nullable = false, updatable = false)
    private LocalDate voucherDate;

    @Column(name = "posting_date")
    private LocalDate postingDate;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "description_detail", columnDefinition = "TEXT")
    private String descriptionDetail;

    @Column(name = "document_ref", length = 100)
    private String documentRef;

    @Column(name = "document_date")
    private LocalDate documentDate;

    @Column(name = "company_code", nullable = false, updatable = false, length = 20)
    private String companyCode;

    @Column(name = "branch_code", length = 20)
    private String branchCode;

    @Column(name = "is_signed", nullable = false)
    private boolean signed;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "signature_data", columnDefinition = "TEXT")
    private String signatureData;

    @Column(name = "signer_id", length = 100)
    private String signerId;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_status", nullable = false, length = 20)
    private LockStatus lockStatus;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static VoucherEntity fromDomain(AccountingVoucher voucher, String idempotencyKey) {
        VoucherEntity entity = new VoucherEntity();
        entity.id = voucher.getId();
        entity.voucherNumber = voucher.getVoucherNumber();
        entity.voucherType = voucher.getVoucherType();
        entity.voucherDate = voucher.getVoucherDate();
        entity.postingDate = voucher.getPostingDate();
        entity.description = voucher.getDescription();
        entity.descriptionDetail = voucher.getDescriptionDetail();
        entity.documentRef = voucher.getDocumentRef();
        entity.documentDate = voucher.getDocumentDate();
        entity.companyCode = voucher.getCompanyCode();
        entity.branchCode = voucher.getBranchCode();
        entity.createdBy = voucher.getCreatedBy();
        entity.idempotencyKey = idempotencyKey;
        entity.copyMutableState(voucher);
        return entity;
    }

    public AccountingVoucher toDomain(List<UUID> journalEntryIds) {
        return AccountingVoucher.builder()
                .id(id)
                .voucherNumber(voucherNumber)
                .voucherType(voucherType)
                .voucherDate(voucherDate)
                .postingDate(postingDate)
                .description(description)
                .descriptionDetail(descriptionDetail)
                .documentRef(documentRef)
                .documentDate(documentDate)
                .companyCode(companyCode)
                .branchCode(branchCode)
                .signed(signed)
                .signedAt(signedAt)
                .signatureData(signatureData)
                .signerId(signerId)
                .locked(locked)
                .lockedAt(lockedAt)
                .lockStatus(lockStatus)
                .journalEntryIds(journalEntryIds)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .version(version != null ? version + 1 : 1)
                .build();
    }

    void updateFromDomain(AccountingVoucher voucher) {
        copyMutableState(voucher);
    }

    private void copyMutableState(AccountingVoucher voucher) {
        this.signed = voucher.isSigned();
        this.signedAt = voucher.getSignedAt();
        this.signatureData = voucher.getSignatureData();
        this.signerId = voucher.getSignerId();
        this.locked = voucher.isLocked();
        this.lockedAt = voucher.getLockedAt();
        this.lockStatus = voucher.getLockStatus();
    }
}
