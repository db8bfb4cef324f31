package com.flagship.vn_accounting.inventory;

import com.flagship.vn_accounting.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Stock-count result. Shortages go to 1381 (pending resolution), surpluses
 * to 3381; a count matching the books has no account.
 */
@Value
public class InventoryReconciliation {

    public static final String SHORTAGE_ACCOUNT = "1381";
    public static final String SURPLUS_ACCOUNT = "3381";

    String productCode;
    BigDecimal actualQuantity;
    BigDecimal bookQuantity;
    Money amount;
    String accountCode;

    public BigDecimal getDifference() {
        return actualQuantity.subtract(bookQuantity);
    }

    public boolean isShortage() {
        return getDifference().signum() < 0;
    }

    public boolean isSurplus() {
        return getDifference().signum() > 0;
    }
}
