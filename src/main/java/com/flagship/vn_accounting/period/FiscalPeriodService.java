package com.flagship.vn_accounting.period;

import com.flagship.vn_accounting.exception.FinancialPeriodClosedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of fiscal periods: the closed-period guard used before any
 * voucher or journal entry is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodService {

    private final FiscalPeriodRepository repository;

    @Value("${accounting.company-code:DEMO}")
    private String companyCode;

    /**
     * @throws FinancialPeriodClosedException if a locked month, quarter or year covers the date
     */
    @Transactional(readOnly = true)
    public void assertPeriodOpen(LocalDate date) {
        List<FiscalPeriodEntity> locked = repository.findLockedCovering(companyCode, date);
        if (!locked.isEmpty()) {
            FiscalPeriod period = locked.get(0).toDomain();
            log.warn("Rejected change dated {}: period {} is {}", date, period.getName(), period.getLockStatus());
            throw new FinancialPeriodClosedException(date, period.getName());
        }
    }

    @Transactional(readOnly = true)
    public boolean isPeriodOpen(LocalDate date) {
        return repository.findLockedCovering(companyCode, date).isEmpty();
    }

    @Transactional(readOnly = true)
    public List<FiscalPeriod> listPeriods(int year) {
        return repository.findByCompanyCodeAndYearOrderByStartDateAsc(companyCode, year)
                .stream()
                .map(FiscalPeriodEntity::toDomain)
                .toList();
    }
}
