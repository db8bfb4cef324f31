package com.flagship.vn_accounting.period;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * A month, quarter or year of a company's books.
 *
 * Locking is monotonic: there is no unlock operation here.
 */
@Value
@Builder(toBuilder = true)
public class FiscalPeriod {
    UUID id;
    String companyCode;
    PeriodType periodType;
    int year;
    int periodValue;
    LocalDate startDate;
    LocalDate endDate;
    boolean locked;
    LockStatus lockStatus;
    Instant lockedAt;
    String lockedBy;
    long version;

    /**
     * Opens a new period. Calendar fiscal year (January start).
     *
     * @param periodValue month 1-12, quarter 1-4, ignored for YEAR
     */
    public static FiscalPeriod open(String companyCode, PeriodType periodType, int year, int periodValue) {
        LocalDate start;
        LocalDate end;
        switch (periodType) {
            case MONTH -> {
                if (periodValue < 1 || periodValue > 12) {
                    throw new IllegalArgumentException("Month must be between 1 and 12: " + periodValue);
                }
                YearMonth month = YearMonth.of(year, periodValue);
                start = month.atDay(1);
                end = month.atEndOfMonth();
            }
            case QUARTER -> {
                if (periodValue < 1 || periodValue > 4) {
                    throw new IllegalArgumentException("Quarter must be between 1 and 4: " + periodValue);
                }
                start = LocalDate.of(year, (periodValue - 1) * 3 + 1, 1);
                end = YearMonth.of(year, periodValue * 3).atEndOfMonth();
            }
            default -> {
                start = LocalDate.of(year, 1, 1);
                end = LocalDate.of(year, 12, 31);
                periodValue = year;
            }
        }
        return FiscalPeriod.builder()
                .id(UUID.randomUUID())
                .companyCode(companyCode)
                .periodType(periodType)
                .year(year)
                .periodValue(periodValue)
                .startDate(start)
                .endDate(end)
                .locked(false)
                .lockStatus(LockStatus.OPEN)
                .version(1)
                .build();
    }

    public FiscalPeriod lock(LockStatus status, String lockedBy) {
        return toBuilder()
                .locked(true)
                .lockStatus(status)
                .lockedAt(Instant.now())
                .lockedBy(lockedBy)
                .version(version + 1)
                .build();
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public String getName() {
        return switch (periodType) {
            case MONTH -> String.format("%d-%02d", year, periodValue);
            case QUARTER -> String.format("%d-Q%d", year, periodValue);
            case YEAR -> String.valueOf(year);
        };
    }
}
