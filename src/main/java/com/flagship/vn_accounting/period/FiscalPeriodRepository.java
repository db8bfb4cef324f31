package com.flagship.vn_accounting.period;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FiscalPeriodRepository extends JpaRepository<FiscalPeriodEntity, UUID> {

    Optional<FiscalPeriodEntity> findByCompanyCodeAndPeriodTypeAndYearAndPeriodValue(
        String companyCode, PeriodType periodType, int year, int periodValue);

    List<FiscalPeriodEntity> findByCompanyCodeAndYearOrderByStartDateAsc(String companyCode, int year);

    /**
     * Locked periods of any type covering the given date.
     */
    @Query("""
        SELECT p FROM FiscalPeriodEntity p
        WHERE p.companyCode = :companyCode
          AND p.locked = true
          AND :date BETWEEN p.startDate AND p.endDate
        ORDER BY p.startDate ASC
        """)
    List<FiscalPeriodEntity> findLockedCovering(@Param("companyCode") String companyCode,
                                                @Param("date") LocalDate date);
}
