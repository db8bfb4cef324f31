package com.flagship.vn_accounting.voucher;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VoucherRepository extends JpaRepository<VoucherEntity, UUID>, JpaSpecificationExecutor<VoucherEntity> {

    Optional<VoucherEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Counts numbers issued for one date, e.g. prefix {@code CT/20250115/}.
     */
    @Query("SELECT COUNT(v) FROM VoucherEntity v WHERE v.voucherNumber LIKE CONCAT(:prefix, '%')")
    long countByNumberPrefix(@Param("prefix") String prefix);

    @Query("""
        SELECT v FROM VoucherEntity v
        WHERE v.companyCode = :companyCode
          AND v.voucherDate BETWEEN :startDate AND :endDate
          AND v.locked = false
        ORDER BY v.voucherDate ASC, v.voucherNumber ASC
        """)
    List<VoucherEntity> findUnlockedInRange(@Param("companyCode") String companyCode,
                                            @Param("startDate") LocalDate startDate,
                                            @Param("endDate") LocalDate endDate);

    static Specification<VoucherEntity> hasCompanyCode(String companyCode) {
        return (root, query, cb) -> cb.equal(root.get("companyCode"), companyCode);
    }

    static Specification<VoucherEntity> dateFrom(LocalDate startDate) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("voucherDate"), startDate);
    }

    static Specification<VoucherEntity> dateTo(LocalDate endDate) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("voucherDate"), endDate);
    }

    static Specification<VoucherEntity> hasType(VoucherType voucherType) {
        return (root, query, cb) -> cb.equal(root.get("voucherType"), voucherType);
    }
}
