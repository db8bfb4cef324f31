package com.flagship.vn_accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.journal.VoucherLineDetail;
import com.flagship.vn_accounting.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a voucher. Amounts are in VND; a foreign amount may be given
 * for reference together with its rate.
 */
@Value
public class VoucherLineRequest {

    @NotBlank(message = "Account code is required")
    @JsonProperty("account_code")
    String accountCode;

    @DecimalMin(value = "0", message = "Debit amount cannot be negative")
    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @DecimalMin(value = "0", message = "Credit amount cannot be negative")
    @JsonProperty("credit_amount")
    BigDecimal creditAmount;

    @JsonProperty("counterpart_account")
    String counterpartAccount;

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("foreign_amount")
    BigDecimal foreignAmount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Foreign currency must be a 3-letter ISO code")
    @JsonProperty("foreign_currency")
    String foreignCurrency;

    @JsonProperty("tax_code")
    String taxCode;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("object_code")
    String objectCode;

    @JsonProperty("object_type")
    String objectType;

    @JsonProperty("contract_code")
    String contractCode;

    public VoucherLineDetail toDomain() {
        return VoucherLineDetail.builder()
                .accountCode(accountCode)
                .debitAmount(debitAmount != null ? Money.vnd(debitAmount) : null)
                .creditAmount(creditAmount != null ? Money.vnd(creditAmount) : null)
                .counterpartAccount(counterpartAccount)
                .description(description)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .exchangeRate(exchangeRate)
                .foreignAmount(foreignAmount != null && foreignCurrency != null
                        ? Money.of(foreignAmount, foreignCurrency) : null)
                .taxCode(taxCode)
                .taxRate(taxRate)
                .objectCode(objectCode)
                .objectType(objectType)
                .contractCode(contractCode)
                .build();
    }
}
