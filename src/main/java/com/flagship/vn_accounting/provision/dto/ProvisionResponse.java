package com.flagship.vn_accounting.provision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.provision.ProvisionBand;
import com.flagship.vn_accounting.provision.ProvisionResult;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ProvisionResponse {

    @JsonProperty("total_provision")
    BigDecimal totalProvision;

    @JsonProperty("items")
    List<Item> items;

    @Value
    public static class Item {
        @JsonProperty("customer_code")
        String customerCode;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("overdue_days")
        int overdueDays;
        @JsonProperty("band")
        ProvisionBand band;
        @JsonProperty("rate")
        BigDecimal rate;
        @JsonProperty("provision")
        BigDecimal provision;
    }

    public static ProvisionResponse from(ProvisionResult result) {
        List<Item> items = result.getItems().stream()
                .map(item -> new Item(
                    item.getReceivable().getCustomerCode(),
                    item.getReceivable().getAmount(),
                    item.getReceivable().getOverdueDays(),
                    item.getBand(),
                    item.getRate(),
                    item.getProvision().getAmount()))
                .toList();
        return new ProvisionResponse(result.getTotalProvision().getAmount(), items);
    }
}
