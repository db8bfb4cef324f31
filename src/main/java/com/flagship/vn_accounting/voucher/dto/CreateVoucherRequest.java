package com.flagship.vn_accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.voucher.VoucherType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for entering a voucher with its journal lines.
 * {@code voucher_type} accepts the enum name or the short code (THU, CHI, ...).
 */
@Value
public class CreateVoucherRequest {

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @NotNull(message = "Voucher date is required")
    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("description_detail")
    String descriptionDetail;

    @JsonProperty("document_ref")
    String documentRef;

    @JsonProperty("document_date")
    LocalDate documentDate;

    @JsonProperty("branch_code")
    String branchCode;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<VoucherLineRequest> lines;
}
