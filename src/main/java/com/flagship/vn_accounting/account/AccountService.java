package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.account.dto.AccountResponse;
import com.flagship.vn_accounting.audit.AuditAction;
import com.flagship.vn_accounting.audit.AuditService;
import com.flagship.vn_accounting.exception.ResourceNotFoundException;
import com.flagship.vn_accounting.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Chart-of-accounts operations for the configured company.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String ENTITY_TYPE = "Account";

    /**
     * Cash, receivable, inventory, fixed asset and payable accounts that
     * should never carry a negative balance.
     */
    static final List<String> CRITICAL_ACCOUNTS = List.of(
        "111", "112",
        "131", "138",
        "151", "152", "156", "157",
        "211", "213",
        "311", "331"
    );

    private final AccountRepository accountRepository;
    private final AuditService auditService;

    @Value("${accounting.company-code:DEMO}")
    private String companyCode;

    @Transactional
    public Account createAccount(String code, String name, AccountType accountType, String parentCode,
                                 boolean detail, BalanceDirection balanceDirection,
                                 BigDecimal openingDebit, BigDecimal openingCredit, String actor) {
        if (accountRepository.findByCompanyCodeAndCode(companyCode, code).isPresent()) {
            throw new IllegalStateException("Account " + code + " already exists");
        }
        if (parentCode != null && accountRepository.findByCompanyCodeAndCode(companyCode, parentCode).isEmpty()) {
            throw new IllegalArgumentException("Parent account not found: " + parentCode);
        }

        Account account = Account.create(code, name, accountType, companyCode,
                balanceDirection != null ? balanceDirection : accountType.getNormalBalance())
                .toBuilder()
                .parentCode(parentCode)
                .detail(detail)
                .openingBalanceDebit(openingDebit != null ? Money.vnd(openingDebit) : null)
                .openingBalanceCredit(openingCredit != null ? Money.vnd(openingCredit) : null)
                .build();
        if (account.hasOpeningBalanceOnBothSides()) {
            log.warn("Account {} has opening balances on both debit and credit sides", code);
        }

        Account saved = accountRepository.save(AccountEntity.fromDomain(account)).toDomain();
        auditService.record(actor, AuditAction.CREATE, ENTITY_TYPE, saved.getId(), null, AccountResponse.from(saved));
        log.info("Created account {} ({}, {})", code, accountType, saved.getBalanceDirection());
        return saved;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String code) {
        return accountRepository.findByCompanyCodeAndCode(companyCode, code)
                .map(AccountEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY_TYPE, code));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountType accountType) {
        List<AccountEntity> entities = accountType != null
                ? accountRepository.findByCompanyCodeAndAccountTypeOrderByCodeAsc(companyCode, accountType)
                : accountRepository.findByCompanyCodeOrderByCodeAsc(companyCode);
        return entities.stream().map(AccountEntity::toDomain).toList();
    }

    /**
     * Looks up accounts by a wildcard pattern: {@code *} matches any run of
     * characters, {@code ?} a single one. {@code 156*} returns 156, 1561, 1562.
     */
    @Transactional(readOnly = true)
    public List<Account> findByPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern is required");
        }
        String like = pattern.trim()
                .replace("%", "")
                .replace("_", "")
                .replace('*', '%')
                .replace('?', '_');
        return accountRepository.findByCodePattern(companyCode, like)
                .stream()
                .map(AccountEntity::toDomain)
                .toList();
    }

    /**
     * @throws IllegalArgumentException listing every code that is unknown or inactive
     */
    @Transactional(readOnly = true)
    public void requireActiveAccounts(Collection<String> codes) {
        Set<String> requested = new LinkedHashSet<>(codes);
        Map<String, AccountEntity> found = accountRepository.findByCompanyCodeAndCodeIn(companyCode, requested)
                .stream()
                .collect(Collectors.toMap(AccountEntity::getCode, Function.identity()));

        Set<String> missing = new TreeSet<>();
        Set<String> inactive = new TreeSet<>();
        for (String code : requested) {
            AccountEntity entity = found.get(code);
            if (entity == null) {
                missing.add(code);
            } else if (!entity.isActive()) {
                inactive.add(code);
            }
        }
        if (!missing.isEmpty() || !inactive.isEmpty()) {
            List<String> problems = new ArrayList<>();
            if (!missing.isEmpty()) {
                problems.add("unknown accounts " + missing);
            }
            if (!inactive.isEmpty()) {
                problems.add("inactive accounts " + inactive);
            }
            throw new IllegalArgumentException("Invalid account codes: " + String.join(", ", problems));
        }
    }

    /**
     * Applies a debit/credit pair to one account inside the caller's transaction.
     * The row version check at flush rejects a concurrent update of the same account.
     */
    @Transactional
    public Account applyPosting(String code, Money debit, Money credit, String actor) {
        AccountEntity entity = accountRepository.findByCompanyCodeAndCode(companyCode, code)
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY_TYPE, code));
        Account before = entity.toDomain();
        Account after = before.postBalance(debit, credit);

        entity.updateFromDomain(after);
        accountRepository.save(entity);
        auditService.record(actor, AuditAction.UPDATE, ENTITY_TYPE, after.getId(),
                AccountResponse.from(before), AccountResponse.from(after));

        log.debug("Posted to account {}: debit={}, credit={}, balance {} -> {}",
                code, debit, credit, before.getCurrentBalance(), after.getCurrentBalance());
        if (after.hasNegativeBalance()) {
            log.warn("Account {} balance is negative after posting: {}", code, after.getCurrentBalance());
        }
        return after;
    }

    /**
     * Advisory scan over {@link #CRITICAL_ACCOUNTS}. Never blocks posting.
     */
    @Transactional(readOnly = true)
    public List<String> checkNegativeBalances() {
        List<String> warnings = accountRepository.findByCompanyCodeAndCodeIn(companyCode, CRITICAL_ACCOUNTS)
                .stream()
                .map(AccountEntity::toDomain)
                .filter(Account::hasNegativeBalance)
                .sorted((a, b) -> a.getCode().compareTo(b.getCode()))
                .map(account -> String.format("Account %s (%s) has a negative balance of %s",
                        account.getCode(), account.getName(), account.getCurrentBalance().getAmount().toPlainString()))
                .toList();
        if (!warnings.isEmpty()) {
            log.warn("Negative balance check found {} account(s)", warnings.size());
        }
        return warnings;
    }
}
