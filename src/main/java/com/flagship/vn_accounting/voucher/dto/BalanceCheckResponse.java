package com.flagship.vn_accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.voucher.BalanceCheck;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class BalanceCheckResponse {

    @JsonProperty("voucher_id")
    UUID voucherId;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("is_balanced")
    boolean balanced;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("errors")
    List<String> errors;

    public static BalanceCheckResponse from(BalanceCheck check) {
        return new BalanceCheckResponse(
            check.getVoucherId(),
            check.getVoucherNumber(),
            check.isBalanced(),
            check.getTotalDebit().getAmount(),
            check.getTotalCredit().getAmount(),
            check.getDifference().getAmount(),
            check.getErrors()
        );
    }
}
