package com.flagship.vn_accounting.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Cost-flow assumption for goods leaving stock (account 156).
 */
public enum CostingMethod {
    FIFO,
    LIFO,
    WEIGHTED_AVERAGE;

    /**
     * Accepts {@code WEIGHTED_AVG} as an alias.
     */
    @JsonCreator
    public static CostingMethod fromValue(String value) {
        if (value == null) {
            return null;
        }
        if ("WEIGHTED_AVG".equalsIgnoreCase(value)) {
            return WEIGHTED_AVERAGE;
        }
        return valueOf(value.toUpperCase());
    }
}
