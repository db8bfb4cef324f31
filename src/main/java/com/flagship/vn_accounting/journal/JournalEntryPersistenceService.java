package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link JournalEntry} and {@link JournalEntryEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryPersistenceService {

    private final JournalEntryRepository repository;

    @Transactional
    public JournalEntry save(JournalEntry entry) {
        JournalEntryEntity saved = repository.save(JournalEntryEntity.fromDomain(entry));
        log.debug("Saved journal entry {} with {} line(s)", saved.getEntryNumber(), saved.getLines().size());
        return saved.toDomain();
    }

    /**
     * Writes posting and locking state. The row version is checked when the
     * surrounding transaction flushes.
     *
     * @return the given entry, which already carries the incremented version
     */
    @Transactional
    public JournalEntry update(JournalEntry entry) {
        JournalEntryEntity existing = repository.findById(entry.getId())
                .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entry.getId()));
        existing.updateFromDomain(entry);
        repository.save(existing);
        log.debug("Updated journal entry {}", entry.getEntryNumber());
        return entry;
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findById(UUID id) {
        return repository.findById(id).map(JournalEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findByEntryNumber(String entryNumber) {
        return repository.findByEntryNumber(entryNumber).map(JournalEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByVoucherId(UUID voucherId) {
        return repository.findByVoucherIdOrderByEntryNumberAsc(voucherId)
                .stream()
                .map(JournalEntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdsByVoucherId(UUID voucherId) {
        return repository.findIdsByVoucherId(voucherId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByPeriod(String companyCode, LocalDate startDate, LocalDate endDate) {
        return repository.findByPeriod(companyCode, startDate, endDate)
                .stream()
                .map(JournalEntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByAccountCode(String companyCode, String accountCode) {
        return repository.findByAccountCode(companyCode, accountCode)
                .stream()
                .map(JournalEntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countByNumberPrefix(String prefix) {
        return repository.countByNumberPrefix(prefix);
    }
}
