package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.journal.VoucherLineDetail;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Caller input for a new voucher, before numbers are assigned.
 */
@Value
@Builder(toBuilder = true)
public class VoucherDraft {
    VoucherType voucherType;
    LocalDate voucherDate;
    LocalDate postingDate;
    String description;
    String descriptionDetail;
    String documentRef;
    LocalDate documentDate;
    String branchCode;
    @Singular
    List<VoucherLineDetail> lines;
}
