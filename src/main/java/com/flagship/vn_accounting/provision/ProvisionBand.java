package com.flagship.vn_accounting.provision;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Overdue-receivable provisioning rates (Circular 48/2019, account 229).
 * Bounds are inclusive; the first band that matches wins.
 */
public enum ProvisionBand {
    UP_TO_90_DAYS(0, 90, "0.00"),
    DAYS_91_TO_180(91, 180, "0.30"),
    DAYS_181_TO_365(181, 365, "0.50"),
    OVER_365_DAYS(366, Integer.MAX_VALUE, "1.00");

    private final int minDays;
    private final int maxDays;
    private final BigDecimal rate;

    ProvisionBand(int minDays, int maxDays, String rate) {
        this.minDays = minDays;
        this.maxDays = maxDays;
        this.rate = new BigDecimal(rate);
    }

    public int getMinDays() {
        return minDays;
    }

    public int getMaxDays() {
        return maxDays;
    }

    public BigDecimal getRate() {
        return rate;
    }

    public boolean covers(int overdueDays) {
        return overdueDays >= minDays && overdueDays <= maxDays;
    }

    /**
     * Empty for negative day counts, which carry no provision.
     */
    public static Optional<ProvisionBand> forOverdueDays(int overdueDays) {
        for (ProvisionBand band : values()) {
            if (band.covers(overdueDays)) {
                return Optional.of(band);
            }
        }
        return Optional.empty();
    }
}
