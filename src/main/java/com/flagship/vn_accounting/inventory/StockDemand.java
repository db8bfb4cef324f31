package com.flagship.vn_accounting.inventory;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class StockDemand {
    String productCode;
    BigDecimal quantity;
}
