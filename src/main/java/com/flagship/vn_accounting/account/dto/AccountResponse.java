package com.flagship.vn_accounting.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.account.Account;
import com.flagship.vn_accounting.account.AccountType;
import com.flagship.vn_accounting.account.BalanceDirection;
import com.flagship.vn_accounting.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_code")
    String parentCode;

    @JsonProperty("is_detail")
    boolean detail;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("opening_balance_debit")
    BigDecimal openingBalanceDebit;

    @JsonProperty("opening_balance_credit")
    BigDecimal openingBalanceCredit;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("balance_direction")
    BalanceDirection balanceDirection;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("version")
    long version;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .code(account.getCode())
                .name(account.getName())
                .accountType(account.getAccountType())
                .parentCode(account.getParentCode())
                .detail(account.isDetail())
                .active(account.isActive())
                .openingBalanceDebit(amountOf(account.getOpeningBalanceDebit()))
                .openingBalanceCredit(amountOf(account.getOpeningBalanceCredit()))
                .currentBalance(amountOf(account.getCurrentBalance()))
                .balanceDirection(account.getBalanceDirection())
                .currency(account.getCurrency())
                .version(account.getVersion())
                .build();
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }
}
