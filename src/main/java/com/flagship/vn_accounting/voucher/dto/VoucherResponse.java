package com.flagship.vn_accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.period.LockStatus;
import com.flagship.vn_accounting.voucher.AccountingVoucher;
import com.flagship.vn_accounting.voucher.VoucherType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VoucherResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @JsonProperty("voucher_type_code")
    String voucherTypeCode;

    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("description_detail")
    String descriptionDetail;

    @JsonProperty("document_ref")
    String documentRef;

    @JsonProperty("document_date")
    LocalDate documentDate;

    @JsonProperty("company_code")
    String companyCode;

    @JsonProperty("branch_code")
    String branchCode;

    @JsonProperty("is_signed")
    boolean signed;

    @JsonProperty("signed_at")
    Instant signedAt;

    @JsonProperty("signer_id")
    String signerId;

    @JsonProperty("is_locked")
    boolean locked;

    @JsonProperty("locked_at")
    Instant lockedAt;

    @JsonProperty("lock_status")
    LockStatus lockStatus;

    @JsonProperty("journal_entry_ids")
    List<UUID> journalEntryIds;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("version")
    long version;

    public static VoucherResponse from(AccountingVoucher voucher) {
        return VoucherResponse.builder()
                .id(voucher.getId())
                .voucherNumber(voucher.getVoucherNumber())
                .voucherType(voucher.getVoucherType())
                .voucherTypeCode(voucher.getVoucherType().getCode())
                .voucherDate(voucher.getVoucherDate())
                .postingDate(voucher.getPostingDate())
                .description(voucher.getDescription())
                .descriptionDetail(voucher.getDescriptionDetail())
                .documentRef(voucher.getDocumentRef())
                .documentDate(voucher.getDocumentDate())
                .companyCode(voucher.getCompanyCode())
                .branchCode(voucher.getBranchCode())
                .signed(voucher.isSigned())
                .signedAt(voucher.getSignedAt())
                .signerId(voucher.getSignerId())
                .locked(voucher.isLocked())
                .lockedAt(voucher.getLockedAt())
                .lockStatus(voucher.getLockStatus())
                .journalEntryIds(voucher.getJournalEntryIds())
                .createdBy(voucher.getCreatedBy())
                .createdAt(voucher.getCreatedAt())
                .version(voucher.getVersion())
                .build();
    }
}
