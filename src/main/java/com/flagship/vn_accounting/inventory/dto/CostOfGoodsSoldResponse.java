package com.flagship.vn_accounting.inventory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.inventory.CostOfGoodsSold;
import com.flagship.vn_accounting.inventory.CostingMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostOfGoodsSoldResponse {

    @JsonProperty("method")
    CostingMethod method;

    @JsonProperty("total_cost")
    BigDecimal totalCost;

    @JsonProperty("average_cost")
    BigDecimal averageCost;

    @JsonProperty("lines")
    List<Line> lines;

    @Value
    public static class Line {
        @JsonProperty("product_code")
        String productCode;
        @JsonProperty("requested_quantity")
        BigDecimal requestedQuantity;
        @JsonProperty("costed_quantity")
        BigDecimal costedQuantity;
        @JsonProperty("shortfall")
        BigDecimal shortfall;
        @JsonProperty("cost")
        BigDecimal cost;
    }

    public static CostOfGoodsSoldResponse from(CostOfGoodsSold result) {
        List<Line> lines = result.getLines().stream()
                .map(line -> new Line(line.getProductCode(), line.getRequestedQuantity(),
                        line.getCostedQuantity(), line.getShortfall(), line.getCost().getAmount()))
                .toList();
        return new CostOfGoodsSoldResponse(result.getMethod(), result.getTotalCost().getAmount(),
                result.getAverageCost(), lines);
    }
}
