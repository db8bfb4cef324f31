package com.flagship.vn_accounting.money.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.account.AccountType;
import com.flagship.vn_accounting.money.ExchangeDifference;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExchangeDifferenceResponse {

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_type")
    AccountType accountType;

    public static ExchangeDifferenceResponse from(ExchangeDifference difference) {
        return new ExchangeDifferenceResponse(difference.getAmount().getAmount(),
                difference.getAccountCode(), difference.getAccountType());
    }
}
