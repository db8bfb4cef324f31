package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.account.Account;
import com.flagship.vn_accounting.account.AccountService;
import com.flagship.vn_accounting.audit.AuditAction;
import com.flagship.vn_accounting.audit.AuditService;
import com.flagship.vn_accounting.exception.AccountingException;
import com.flagship.vn_accounting.exception.EntityLockedException;
import com.flagship.vn_accounting.exception.ResourceNotFoundException;
import com.flagship.vn_accounting.journal.dto.JournalEntryResponse;
import com.flagship.vn_accounting.journal.event.JournalEntryPostedEvent;
import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.observability.AccountingMetrics;
import com.flagship.vn_accounting.outbox.OutboxService;
import com.flagship.vn_accounting.period.FiscalPeriodService;
import com.flagship.vn_accounting.period.LockStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Commits journal entries to the ledger and freezes them.
 *
 * Posting flow, all in one transaction:
 * <ol>
 *   <li>reject a locked entry or one dated in a locked period</li>
 *   <li>{@link JournalEntry#post} (balance and double-post checks)</li>
 *   <li>apply the lines to their accounts, aggregated per account code</li>
 *   <li>audit row and JournalEntryPosted outbox event</li>
 * </ol>
 * A concurrent post of the same entry fails on the row version at flush.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalPostingService {

    static final String ENTITY_TYPE = JournalEntryPostedEvent.AGGREGATE_TYPE;

    private final JournalEntryPersistenceService persistenceService;
    private final AccountService accountService;
    private final FiscalPeriodService fiscalPeriodService;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;

    @Value("${accounting.company-code:DEMO}")
    private String companyCode;

    @Transactional
    public PostingResult postEntry(UUID entryId, String actor) {
        long startTime = System.currentTimeMillis();
        JournalEntry entry = getEntry(entryId);
        try {
            PostingResult result = post(entry, actor);
            metrics.recordEntryPosted("success");
            return result;
        } catch (AccountingException e) {
            metrics.recordEntryPosted("rejected");
            log.warn("Posting of entry {} rejected: {}", entry.getEntryNumber(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("post_entry", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Posts every entry of the voucher that is not posted yet, in entry
     * number order, within one transaction. If any entry is rejected none of
     * them stays posted.
     */
    @Transactional
    public List<PostingResult> postVoucherEntries(UUID voucherId, String actor) {
        List<JournalEntry> entries = persistenceService.findByVoucherId(voucherId);
        if (entries.isEmpty()) {
            throw new ResourceNotFoundException("JournalEntry", "voucher " + voucherId);
        }
        List<PostingResult> results = new ArrayList<>();
        for (JournalEntry entry : entries) {
            if (!entry.isPosted()) {
                results.add(postEntry(entry.getId(), actor));
            }
        }
        return results;
    }

    private PostingResult post(JournalEntry entry, String actor) {
        if (!entry.canModify()) {
            throw new EntityLockedException(ENTITY_TYPE, entry.getEntryNumber(), entry.getLockStatus().name());
        }
        fiscalPeriodService.assertPeriodOpen(entry.getVoucherDate());
        if (!entry.getPostingDate().equals(entry.getVoucherDate())) {
            fiscalPeriodService.assertPeriodOpen(entry.getPostingDate());
        }

        JournalEntry posted = persistenceService.update(entry.post(actor));

        // Sorted by code so concurrent postings touch accounts in the same order.
        Map<String, Money> debits = new TreeMap<>();
        Map<String, Money> credits = new TreeMap<>();
        for (VoucherLineDetail line : posted.getLines()) {
            debits.merge(line.getAccountCode(), orZero(line.getDebitAmount()), Money::add);
            credits.merge(line.getAccountCode(), orZero(line.getCreditAmount()), Money::add);
        }

        List<Account> accounts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, Money> debit : debits.entrySet()) {
            Account account = accountService.applyPosting(
                debit.getKey(), debit.getValue(), credits.get(debit.getKey()), actor);
            accounts.add(account);
            if (account.hasNegativeBalance()) {
                warnings.add(String.format("Account %s balance is negative: %s",
                        account.getCode(), account.getCurrentBalance().getAmount().toPlainString()));
            }
        }

        auditService.record(actor, AuditAction.POST, ENTITY_TYPE, posted.getId(),
                JournalEntryResponse.from(entry), JournalEntryResponse.from(posted));
        outboxService.saveEvent(ENTITY_TYPE, posted.getId(),
                JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.from(posted));

        log.info("Posted entry {}: debit={}, credit={}, accounts={}",
                posted.getEntryNumber(), posted.getTotalDebit(), posted.getTotalCredit(), debits.keySet());
        return new PostingResult(posted, List.copyOf(accounts), List.copyOf(warnings));
    }

    @Transactional
    public JournalEntry lockEntry(UUID entryId, String actor) {
        return lockEntry(getEntry(entryId), LockStatus.MANUAL, actor);
    }

    /**
     * Total: an entry that is already locked is returned unchanged.
     */
    @Transactional
    public JournalEntry lockEntry(JournalEntry entry, LockStatus lockStatus, String actor) {
        if (entry.isLocked()) {
            log.debug("Entry {} already locked ({})", entry.getEntryNumber(), entry.getLockStatus());
            return entry;
        }
        JournalEntry locked = persistenceService.update(entry.lock(lockStatus));
        auditService.record(actor, AuditAction.LOCK, ENTITY_TYPE, locked.getId(),
                JournalEntryResponse.from(entry), JournalEntryResponse.from(locked));
        log.info("Locked entry {} ({})", locked.getEntryNumber(), lockStatus);
        return locked;
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        return persistenceService.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY_TYPE, entryId));
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByPeriod(LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date must not be after end_date");
        }
        return persistenceService.findByPeriod(companyCode, startDate, endDate);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByAccountCode(String accountCode) {
        return persistenceService.findByAccountCode(companyCode, accountCode);
    }

    private static Money orZero(Money amount) {
        return amount != null ? amount : Money.zero(Money.VND);
    }
}
