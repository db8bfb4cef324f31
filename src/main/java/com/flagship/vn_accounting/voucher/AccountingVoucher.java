package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.exception.AlreadySignedException;
import com.flagship.vn_accounting.period.LockStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Source accounting document (Articles 8-9, Appendix I).
 *
 * Signed at most once. Locking is monotonic.
 */
@Value
@Builder(toBuilder = true)
public class AccountingVoucher {
    UUID id;
    String voucherNumber;
    VoucherType voucherType;
    LocalDate voucherDate;
    LocalDate postingDate;
    String description;
    String descriptionDetail;
    String documentRef;
    LocalDate documentDate;
    String companyCode;
    String branchCode;

    boolean signed;
    Instant signedAt;
    String signatureData;
    String signerId;

    boolean locked;
    Instant lockedAt;
    LockStatus lockStatus;

    @Singular
    List<UUID> journalEntryIds;
    String createdBy;
    Instant createdAt;
    long version;

    public static AccountingVoucher create(String voucherNumber, VoucherType voucherType,
                                           LocalDate voucherDate, String description,
                                           String companyCode, String createdBy) {
        return AccountingVoucher.builder()
                .id(UUID.randomUUID())
                .voucherNumber(voucherNumber)
                .voucherType(voucherType)
                .voucherDate(voucherDate)
                .postingDate(voucherDate)
                .description(description)
                .companyCode(companyCode)
                .lockStatus(LockStatus.OPEN)
                .createdBy(createdBy)
                .createdAt(Instant.now())
                .version(1)
                .build();
    }

    /**
     * @throws AlreadySignedException if the voucher carries a signature already
     */
    public AccountingVoucher sign(String signerId, String signature) {
        if (signed) {
            throw new AlreadySignedException(voucherNumber);
        }
        return toBuilder()
                .signed(true)
                .signedAt(Instant.now())
                .signerId(signerId)
                .signatureData(signature)
                .version(version + 1)
                .build();
    }

    public AccountingVoucher lock(LockStatus lockStatus) {
        return toBuilder()
                .locked(true)
                .lockedAt(Instant.now())
                .lockStatus(lockStatus)
                .version(version + 1)
                .build();
    }

    public boolean canModify() {
        return !locked;
    }
}
