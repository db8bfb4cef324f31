package com.flagship.vn_accounting.period;

import com.flagship.vn_accounting.audit.AuditAction;
import com.flagship.vn_accounting.audit.AuditService;
import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.journal.JournalEntryPersistenceService;
import com.flagship.vn_accounting.journal.JournalPostingService;
import com.flagship.vn_accounting.observability.AccountingMetrics;
import com.flagship.vn_accounting.period.dto.FiscalPeriodResponse;
import com.flagship.vn_accounting.voucher.AccountingVoucher;
import com.flagship.vn_accounting.voucher.VoucherPersistenceService;
import com.flagship.vn_accounting.voucher.VoucherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Period-end book closing (Articles 18-22).
 *
 * Locking a month, quarter or year freezes the period record and every
 * voucher and journal entry dated inside it. There is no unlock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodLockService {

    static final String ENTITY_TYPE = "FiscalPeriod";

    private final FiscalPeriodRepository repository;
    private final VoucherPersistenceService voucherPersistenceService;
    private final VoucherService voucherService;
    private final JournalEntryPersistenceService journalEntryPersistenceService;
    private final JournalPostingService journalPostingService;
    private final AuditService auditService;
    private final AccountingMetrics metrics;

    @Value("${accounting.company-code:DEMO}")
    private String companyCode;

    /**
     * Locks the period, creating its record first if it was never opened.
     * Locking a period that is already locked changes nothing.
     *
     * @param periodValue month 1-12 or quarter 1-4; ignored for YEAR
     */
    @Transactional
    public PeriodLockResult lockPeriod(PeriodType periodType, int year, int periodValue, String actor) {
        int value = periodType == PeriodType.YEAR ? year : periodValue;
        Optional<FiscalPeriodEntity> existing =
                repository.findByCompanyCodeAndPeriodTypeAndYearAndPeriodValue(companyCode, periodType, year, value);

        FiscalPeriod period = existing.map(FiscalPeriodEntity::toDomain)
                .orElseGet(() -> FiscalPeriod.open(companyCode, periodType, year, value));
        if (period.isLocked()) {
            log.info("Period {} already locked ({})", period.getName(), period.getLockStatus());
            return new PeriodLockResult(period, 0, 0, true);
        }

        LockStatus lockStatus = LockStatus.forPeriod(periodType);
        FiscalPeriod locked = period.lock(lockStatus, actor);
        if (existing.isPresent()) {
            FiscalPeriodEntity entity = existing.get();
            entity.updateFromDomain(locked);
            repository.save(entity);
        } else {
            locked = repository.save(FiscalPeriodEntity.fromDomain(locked)).toDomain();
        }

        int vouchers = 0;
        for (AccountingVoucher voucher : voucherPersistenceService.findUnlockedInRange(
                companyCode, locked.getStartDate(), locked.getEndDate())) {
            voucherService.applyLock(voucher, lockStatus, actor);
            vouchers++;
        }

        // Entries whose voucher was locked above are already frozen.
        int entries = 0;
        for (JournalEntry entry : journalEntryPersistenceService.findByPeriod(
                companyCode, locked.getStartDate(), locked.getEndDate())) {
            if (!entry.isLocked()) {
                journalPostingService.lockEntry(entry, lockStatus, actor);
                entries++;
            }
        }

        auditService.record(actor, AuditAction.LOCK, ENTITY_TYPE, locked.getId(),
                FiscalPeriodResponse.from(period), FiscalPeriodResponse.from(locked));
        metrics.recordPeriodLocked(periodType.name());

        log.info("Locked period {} ({}): {} vouchers, {} additional entries",
                locked.getName(), lockStatus, vouchers, entries);
        return new PeriodLockResult(locked, vouchers, entries, false);
    }
}
