package com.flagship.vn_accounting.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    Optional<JournalEntryEntity> findByEntryNumber(String entryNumber);

    List<JournalEntryEntity> findByVoucherIdOrderByEntryNumberAsc(UUID voucherId);

    @Query("SELECT e.id FROM JournalEntryEntity e WHERE e.voucherId = :voucherId ORDER BY e.entryNumber ASC")
    List<UUID> findIdsByVoucherId(@Param("voucherId") UUID voucherId);

    @Query("SELECT COUNT(e) FROM JournalEntryEntity e WHERE e.entryNumber LIKE CONCAT(:prefix, '%')")
    long countByNumberPrefix(@Param("prefix") String prefix);

    @Query("""
        SELECT e FROM JournalEntryEntity e
        WHERE e.companyCode = :companyCode
          AND e.voucherDate BETWEEN :startDate AND :endDate
        ORDER BY e.voucherDate ASC, e.entryNumber ASC
        """)
    List<JournalEntryEntity> findByPeriod(@Param("companyCode") String companyCode,
                                          @Param("startDate") LocalDate startDate,
                                          @Param("endDate") LocalDate endDate);

    /**
     * Entries with at least one line on the given account.
     */
    @Query("""
        SELECT DISTINCT e FROM JournalEntryEntity e JOIN e.lines l
        WHERE e.companyCode = :companyCode AND l.accountCode = :accountCode
        ORDER BY e.voucherDate ASC, e.entryNumber ASC
        """)
    List<JournalEntryEntity> findByAccountCode(@Param("companyCode") String companyCode,
                                               @Param("accountCode") String accountCode);
}
