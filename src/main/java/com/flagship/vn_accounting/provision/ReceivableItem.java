package com.flagship.vn_accounting.provision;

import lombok.Value;

import java.math.BigDecimal;

/**
 * An open receivable in VND with the days it is past due.
 */
@Value
public class ReceivableItem {
    String customerCode;
    BigDecimal amount;
    int overdueDays;
}
