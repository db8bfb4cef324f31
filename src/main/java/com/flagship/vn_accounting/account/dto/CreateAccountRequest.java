package com.flagship.vn_accounting.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.account.AccountType;
import com.flagship.vn_accounting.account.BalanceDirection;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for opening a chart-of-accounts node.
 * Balance direction is optional; contra accounts pass it explicitly.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @Pattern(regexp = "^[0-9]{3,10}$", message = "Account code must be 3 to 10 digits")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Account name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_code")
    String parentCode;

    @JsonProperty("is_detail")
    boolean detail;

    @JsonProperty("balance_direction")
    BalanceDirection balanceDirection;

    @DecimalMin(value = "0", message = "Opening debit balance cannot be negative")
    @JsonProperty("opening_balance_debit")
    BigDecimal openingBalanceDebit;

    @DecimalMin(value = "0", message = "Opening credit balance cannot be negative")
    @JsonProperty("opening_balance_credit")
    BigDecimal openingBalanceCredit;
}
