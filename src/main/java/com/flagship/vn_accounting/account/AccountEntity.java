package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a chart-of-accounts row.
 *
 * No setters: balances change only through {@link #updateFromDomain(Account)}.
 * The row version starts at 0 and is managed by Hibernate; the domain version
 * is always one ahead of it.
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_accounts_company_code", columnNames = {"company_code", "code"}),
    indexes = {
        @Index(name = "idx_accounts_parent_code", columnList = "parent_code"),
        @Index(name = "idx_accounts_type", columnList = "account_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_code", nullable = false, updatable = false, length = 20)
    private String companyCode;

    @Column(nullable = false, updatable = false, length = 20)
    private String code;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 30)
    private AccountType accountType;

    @Column(name = "parent_code", length = 20)
    private String parentCode;

    @Column(name = "is_detail", nullable = false)
    private boolean detail;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_system", nullable = false)
    private boolean system;

    @Column(name = "opening_balance_debit", precision = 19, scale = 4)
    private BigDecimal openingBalanceDebit;

    @Column(name = "opening_balance_credit", precision = 19, scale = 4)
    private BigDecimal openingBalanceCredit;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal currentBalance;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_direction", nullable = false, updatable = false, length = 10)
    private BalanceDirection balanceDirection;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        AccountEntity entity = new AccountEntity();
        entity.id = account.getId();
        entity.companyCode = account.getCompanyCode();
        entity.code = account.getCode();
        entity.name = account.getName();
        entity.accountType = account.getAccountType();
        entity.parentCode = account.getParentCode();
        entity.detail = account.isDetail();
        entity.active = account.isActive();
        entity.system = account.isSystem();
        entity.openingBalanceDebit = amountOf(account.getOpeningBalanceDebit());
        entity.openingBalanceCredit = amountOf(account.getOpeningBalanceCredit());
        entity.currentBalance = account.getCurrentBalance() != null
                ? account.getCurrentBalance().getAmount()
                : BigDecimal.ZERO;
        entity.balanceDirection = account.getBalanceDirection();
        entity.currency = account.getCurrency();
        return entity;
    }

    public Account toDomain() {
        return Account.builder()
                .id(id)
                .code(code)
                .name(name)
                .accountType(accountType)
                .companyCode(companyCode)
                .parentCode(parentCode)
                .detail(detail)
                .active(active)
                .system(system)
                .openingBalanceDebit(moneyOf(openingBalanceDebit))
                .openingBalanceCredit(moneyOf(openingBalanceCredit))
                .currentBalance(Money.of(currentBalance, currency))
                .balanceDirection(balanceDirection)
                .currency(currency)
                .version(version != null ? version + 1 : 1)
                .build();
    }

    /**
     * Copies the mutable state. Code, company and balance direction never change.
     */
    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.parentCode = account.getParentCode();
        this.detail = account.isDetail();
        this.active = account.isActive();
        this.openingBalanceDebit = amountOf(account.getOpeningBalanceDebit());
        this.openingBalanceCredit = amountOf(account.getOpeningBalanceCredit());
        this.currentBalance = account.getCurrentBalance().getAmount();
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }

    private Money moneyOf(BigDecimal amount) {
        return amount != null ? Money.of(amount, currency) : null;
    }
}
