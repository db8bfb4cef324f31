package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.account.AccountService;
import com.flagship.vn_accounting.audit.AuditAction;
import com.flagship.vn_accounting.audit.AuditService;
import com.flagship.vn_accounting.exception.EntityLockedException;
import com.flagship.vn_accounting.exception.JournalEntryNotBalancedException;
import com.flagship.vn_accounting.exception.ResourceNotFoundException;
import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.journal.JournalEntryPersistenceService;
import com.flagship.vn_accounting.journal.JournalPostingService;
import com.flagship.vn_accounting.journal.VoucherLineDetail;
import com.flagship.vn_accounting.journal.dto.JournalEntryResponse;
import com.flagship.vn_accounting.journal.event.JournalEntryPostedEvent;
import com.flagship.vn_accounting.observability.AccountingMetrics;
import com.flagship.vn_accounting.outbox.OutboxService;
import com.flagship.vn_accounting.period.FiscalPeriodService;
import com.flagship.vn_accounting.period.LockStatus;
import com.flagship.vn_accounting.voucher.dto.VoucherResponse;
import com.flagship.vn_accounting.voucher.event.VoucherCreatedEvent;
import com.flagship.vn_accounting.voucher.event.VoucherEvent;
import com.flagship.vn_accounting.voucher.event.VoucherLockedEvent;
import com.flagship.vn_accounting.voucher.event.VoucherSignedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Voucher entry, signing and locking.
 *
 * Every state change writes its audit row and outbox event in the same
 * transaction as the change itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherService {

    static final String ENTITY_TYPE = VoucherEvent.AGGREGATE_TYPE;

    private final VoucherPersistenceService voucherPersistenceService;
    private final JournalEntryPersistenceService journalEntryPersistenceService;
    private final JournalPostingService journalPostingService;
    private final VoucherNumberGenerator numberGenerator;
    private final IdempotencyService idempotencyService;
    private final AccountService accountService;
    private final FiscalPeriodService fiscalPeriodService;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;

    @Value("${accounting.company-code:DEMO}")
    private String companyCode;

    /**
     * Creates a voucher and its journal entry.
     *
     * @param idempotencyKey may be null; when given, a repeated call returns the earlier voucher
     * @throws JournalEntryNotBalancedException if the lines' debits and credits differ
     * @throws IllegalArgumentException for malformed lines or unknown/inactive accounts
     * @throws com.flagship.vn_accounting.exception.FinancialPeriodClosedException if the date is in a locked period
     */
    @Transactional
    public VoucherCreation createVoucher(VoucherDraft draft, String idempotencyKey, String actor) {
        if (idempotencyKey != null) {
            Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
            if (existingId.isPresent()) {
                metrics.recordIdempotencyHit();
                AccountingVoucher existing = getVoucher(existingId.get());
                log.info("Idempotency key already used, returning voucher {}", existing.getVoucherNumber());
                return new VoucherCreation(existing, getJournalEntries(existing.getId()), true);
            }
            metrics.recordIdempotencyMiss();
        }

        String type = draft.getVoucherType() != null ? draft.getVoucherType().name() : null;
        try {
            VoucherCreation creation = create(draft, idempotencyKey, actor);
            metrics.recordVoucherCreated(type, "success");
            return creation;
        } catch (RuntimeException e) {
            metrics.recordVoucherCreated(type, e instanceof JournalEntryNotBalancedException ? "unbalanced" : "error");
            throw e;
        }
    }

    private VoucherCreation create(VoucherDraft draft, String idempotencyKey, String actor) {
        if (draft.getVoucherType() == null || draft.getVoucherDate() == null) {
            throw new IllegalArgumentException("Voucher type and voucher date are required");
        }
        validateLines(draft.getLines());

        LocalDate postingDate = draft.getPostingDate() != null ? draft.getPostingDate() : draft.getVoucherDate();
        String voucherNumber = numberGenerator.nextVoucherNumber(draft.getVoucherDate());
        String entryNumber = numberGenerator.nextEntryNumber(draft.getVoucherDate());

        AccountingVoucher voucher = AccountingVoucher.create(voucherNumber, draft.getVoucherType(),
                draft.getVoucherDate(), draft.getDescription(), companyCode, actor)
                .toBuilder()
                .postingDate(postingDate)
                .descriptionDetail(draft.getDescriptionDetail())
                .documentRef(draft.getDocumentRef())
                .documentDate(draft.getDocumentDate())
                .branchCode(draft.getBranchCode())
                .build();

        JournalEntry entry = JournalEntry.create(entryNumber, voucher.getId(), companyCode,
                draft.getVoucherDate(), postingDate, draft.getDescription(), draft.getLines(), actor)
                .toBuilder()
                .descriptionDetail(draft.getDescriptionDetail())
                .build();
        if (!entry.isBalanced()) {
            throw new JournalEntryNotBalancedException(entryNumber,
                    entry.getTotalDebit().getAmount(), entry.getTotalCredit().getAmount());
        }
        if (entry.getTotalDebit().isZero()) {
            throw new IllegalArgumentException("Voucher total must be greater than zero");
        }

        Set<String> accountCodes = new LinkedHashSet<>();
        draft.getLines().forEach(line -> accountCodes.add(line.getAccountCode()));
        accountService.requireActiveAccounts(accountCodes);

        fiscalPeriodService.assertPeriodOpen(draft.getVoucherDate());
        if (!postingDate.equals(draft.getVoucherDate())) {
            fiscalPeriodService.assertPeriodOpen(postingDate);
        }

        AccountingVoucher saved = voucherPersistenceService.save(
            voucher.toBuilder().journalEntryId(entry.getId()).build(), idempotencyKey);
        JournalEntry savedEntry = journalEntryPersistenceService.save(entry);

        auditService.record(actor, AuditAction.CREATE, ENTITY_TYPE, saved.getId(),
                null, VoucherResponse.from(saved));
        auditService.record(actor, AuditAction.CREATE, JournalEntryPostedEvent.AGGREGATE_TYPE, savedEntry.getId(),
                null, JournalEntryResponse.from(savedEntry));
        outboxService.saveEvent(ENTITY_TYPE, saved.getId(),
                VoucherCreatedEvent.EVENT_TYPE, VoucherCreatedEvent.from(saved, savedEntry));

        if (idempotencyKey != null) {
            idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());
        }

        log.info("Created voucher {} ({}) with entry {}: debit={}, credit={}",
                saved.getVoucherNumber(), saved.getVoucherType().getCode(), savedEntry.getEntryNumber(),
                savedEntry.getTotalDebit(), savedEntry.getTotalCredit());
        return new VoucherCreation(saved, List.of(savedEntry), false);
    }

    private static void validateLines(List<VoucherLineDetail> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A voucher needs at least one line");
        }
        for (int i = 0; i < lines.size(); i++) {
            VoucherLineDetail line = lines.get(i);
            int lineNumber = i + 1;
            if (line.getAccountCode() == null || line.getAccountCode().isBlank()) {
                throw new IllegalArgumentException("Line " + lineNumber + ": account code is required");
            }
            boolean hasDebit = isPositive(line.getDebitAmount() != null ? line.getDebitAmount().getAmount() : null);
            boolean hasCredit = isPositive(line.getCreditAmount() != null ? line.getCreditAmount().getAmount() : null);
            if (hasDebit == hasCredit) {
                throw new IllegalArgumentException(
                    "Line " + lineNumber + ": exactly one of debit or credit amount must be greater than zero");
            }
        }
    }

    private static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    /**
     * Signs the voucher once. The signature defaults to a timestamp marker.
     *
     * @throws EntityLockedException if the voucher is locked
     * @throws com.flagship.vn_accounting.exception.AlreadySignedException if it was signed before
     */
    @Transactional
    public AccountingVoucher signVoucher(UUID voucherId, String signerId, String signatureData, String actor) {
        AccountingVoucher voucher = getVoucher(voucherId);
        if (!voucher.canModify()) {
            throw new EntityLockedException(ENTITY_TYPE, voucher.getVoucherNumber(), voucher.getLockStatus().name());
        }
        String signer = signerId != null && !signerId.isBlank() ? signerId : actor;
        String signature = signatureData != null && !signatureData.isBlank()
                ? signatureData
                : "SIGNED_" + Instant.now().toEpochMilli();

        AccountingVoucher signed = voucherPersistenceService.update(voucher.sign(signer, signature));
        auditService.record(actor, AuditAction.SIGN, ENTITY_TYPE, signed.getId(),
                VoucherResponse.from(voucher), VoucherResponse.from(signed));
        outboxService.saveEvent(ENTITY_TYPE, signed.getId(),
                VoucherSignedEvent.EVENT_TYPE, VoucherSignedEvent.from(signed));
        metrics.recordVoucherSigned();

        log.info("Voucher {} signed by {}", signed.getVoucherNumber(), signer);
        return signed;
    }

    @Transactional
    public AccountingVoucher lockVoucher(UUID voucherId, String actor) {
        return applyLock(getVoucher(voucherId), LockStatus.MANUAL, actor);
    }

    /**
     * Locks the voucher and its journal entries. A voucher that is already
     * locked keeps its existing status and is returned unchanged.
     */
    @Transactional
    public AccountingVoucher applyLock(AccountingVoucher voucher, LockStatus lockStatus, String actor) {
        if (voucher.isLocked()) {
            log.info("Voucher {} already locked ({})", voucher.getVoucherNumber(), voucher.getLockStatus());
            return voucher;
        }
        AccountingVoucher locked = voucherPersistenceService.update(voucher.lock(lockStatus));
        for (JournalEntry entry : journalEntryPersistenceService.findByVoucherId(voucher.getId())) {
            journalPostingService.lockEntry(entry, lockStatus, actor);
        }

        auditService.record(actor, AuditAction.LOCK, ENTITY_TYPE, locked.getId(),
                VoucherResponse.from(voucher), VoucherResponse.from(locked));
        outboxService.saveEvent(ENTITY_TYPE, locked.getId(),
                VoucherLockedEvent.EVENT_TYPE, VoucherLockedEvent.from(locked, actor));
        metrics.recordVoucherLocked(lockStatus.name());

        log.info("Voucher {} locked ({})", locked.getVoucherNumber(), lockStatus);
        return locked;
    }

    /**
     * @throws ResourceNotFoundException if the voucher has no journal entries
     */
    @Transactional(readOnly = true)
    public BalanceCheck checkBalance(UUID voucherId) {
        AccountingVoucher voucher = getVoucher(voucherId);
        List<JournalEntry> entries = journalEntryPersistenceService.findByVoucherId(voucherId);
        if (entries.isEmpty()) {
            throw new ResourceNotFoundException("JournalEntry", "voucher " + voucher.getVoucherNumber());
        }
        BalanceCheck check = BalanceCheck.of(voucher, entries);
        if (!check.isBalanced()) {
            log.warn("Voucher {} is not balanced: {}", voucher.getVoucherNumber(), check.getErrors());
        }
        return check;
    }

    @Transactional(readOnly = true)
    public AccountingVoucher getVoucher(UUID voucherId) {
        return voucherPersistenceService.findById(voucherId)
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY_TYPE, voucherId));
    }

    @Transactional(readOnly = true)
    public List<AccountingVoucher> listVouchers(LocalDate startDate, LocalDate endDate, VoucherType voucherType,
                                                int page, int size) {
        return voucherPersistenceService.search(companyCode, startDate, endDate, voucherType, page, size);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> getJournalEntries(UUID voucherId) {
        return journalEntryPersistenceService.findByVoucherId(voucherId);
    }
}
