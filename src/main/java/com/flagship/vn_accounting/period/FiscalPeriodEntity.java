package com.flagship.vn_accounting.period;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "fiscal_periods",
    uniqueConstraints = @UniqueConstraint(name = "uk_fiscal_periods",
            columnNames = {"company_code", "period_type", "year", "period_value"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FiscalPeriodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_code", nullable = false, updatable = false, length = 20)
    private String companyCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, updatable = false, length = 10)
    private PeriodType periodType;

    @Column(nullable = false, updatable = false)
    private int year;

    @Column(name = "period_value", nullable = false, updatable = false)
    private int periodValue;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_status", nullable = false, length = 20)
    private LockStatus lockStatus;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FiscalPeriodEntity fromDomain(FiscalPeriod period) {
        FiscalPeriodEntity entity = new FiscalPeriodEntity();
        entity.id = period.getId();
        entity.companyCode = period.getCompanyCode();
        entity.periodType = period.getPeriodType();
        entity.year = period.getYear();
        entity.periodValue = period.getPeriodValue();
        entity.startDate = period.getStartDate();
        entity.endDate = period.getEndDate();
        entity.updateFromDomain(period);
        return entity;
    }

    public FiscalPeriod toDomain() {
        return FiscalPeriod.builder()
                .id(id)
                .companyCode(companyCode)
                .periodType(periodType)
                .year(year)
                .periodValue(periodValue)
                .startDate(startDate)
                .endDate(endDate)
                .locked(locked)
                .lockStatus(lockStatus)
                .lockedAt(lockedAt)
                .lockedBy(lockedBy)
                .version(version != null ? version + 1 : 1)
                .build();
    }

    void updateFromDomain(FiscalPeriod period) {
        this.locked = period.isLocked();
        this.lockStatus = period.getLockStatus();
        this.lockedAt = period.getLockedAt();
        this.lockedBy = period.getLockedBy();
    }
}
