package com.flagship.vn_accounting.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByCompanyCodeAndCode(String companyCode, String code);

    List<AccountEntity> findByCompanyCodeOrderByCodeAsc(String companyCode);

    List<AccountEntity> findByCompanyCodeAndAccountTypeOrderByCodeAsc(String companyCode, AccountType accountType);

    List<AccountEntity> findByCompanyCodeAndCodeIn(String companyCode, Collection<String> codes);

    /**
     * Codes matching a SQL LIKE pattern, e.g. {@code 156%}.
     */
    @Query("""
        SELECT a FROM AccountEntity a
        WHERE a.companyCode = :companyCode AND a.code LIKE :pattern
        ORDER BY a.code ASC
        """)
    List<AccountEntity> findByCodePattern(@Param("companyCode") String companyCode,
                                          @Param("pattern") String pattern);
}
