package com.flagship.vn_accounting.money;

import com.flagship.vn_accounting.account.AccountType;
import lombok.Value;

/**
 * Exchange-rate difference together with the account it is booked to.
 */
@Value
public class ExchangeDifference {
    Money amount;
    String accountCode;
    AccountType accountType;
}
