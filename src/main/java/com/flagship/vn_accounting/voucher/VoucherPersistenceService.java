package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.exception.ResourceNotFoundException;
import com.flagship.vn_accounting.journal.JournalEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link AccountingVoucher} and {@link VoucherEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherPersistenceService {

    private final VoucherRepository voucherRepository;
    private final JournalEntryRepository journalEntryRepository;

    @Transactional
    public AccountingVoucher save(AccountingVoucher voucher, String idempotencyKey) {
        VoucherEntity saved = voucherRepository.save(VoucherEntity.fromDomain(voucher, idempotencyKey));
        log.debug("Saved voucher {} with idempotency key {}", saved.getVoucherNumber(), idempotencyKey);
        return saved.toDomain(voucher.getJournalEntryIds());
    }

    /**
     * Writes signing and locking state. The row version is checked when the
     * surrounding transaction flushes.
     *
     * @return the given voucher, which already carries the incremented version
     */
    @Transactional
    public AccountingVoucher update(AccountingVoucher voucher) {
        VoucherEntity existing = voucherRepository.findById(voucher.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Voucher", voucher.getId()));
        existing.updateFromDomain(voucher);
        voucherRepository.save(existing);
        log.debug("Updated voucher {}", voucher.getVoucherNumber());
        return voucher;
    }

    @Transactional(readOnly = true)
    public Optional<AccountingVoucher> findById(UUID id) {
        return voucherRepository.findById(id).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean existsById(UUID id) {
        return voucherRepository.existsById(id);
    }

    @Transactional(readOnly = true)
    public Optional<AccountingVoucher> findByIdempotencyKey(String idempotencyKey) {
        return voucherRepository.findByIdempotencyKey(idempotencyKey).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public List<AccountingVoucher> search(String companyCode, LocalDate startDate, LocalDate endDate,
                                          VoucherType voucherType, int page, int size) {
        Specification<VoucherEntity> spec = VoucherRepository.hasCompanyCode(companyCode);
        if (startDate != null) {
            spec = spec.and(VoucherRepository.dateFrom(startDate));
        }
        if (endDate != null) {
            spec = spec.and(VoucherRepository.dateTo(endDate));
        }
        if (voucherType != null) {
            spec = spec.and(VoucherRepository.hasType(voucherType));
        }
        PageRequest pageRequest = PageRequest.of(page, size,
                Sort.by(Sort.Order.desc("voucherDate"), Sort.Order.desc("voucherNumber")));
        return voucherRepository.findAll(spec, pageRequest)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AccountingVoucher> findUnlockedInRange(String companyCode, LocalDate startDate, LocalDate endDate) {
        return voucherRepository.findUnlockedInRange(companyCode, startDate, endDate)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countByNumberPrefix(String prefix) {
        return voucherRepository.countByNumberPrefix(prefix);
    }

    private AccountingVoucher toDomain(VoucherEntity entity) {
        return entity.toDomain(journalEntryRepository.findIdsByVoucherId(entity.getId()));
    }
}
