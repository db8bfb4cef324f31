package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Journal line row. Lines are written once with their entry and never updated.
 */
@Entity
@Table(name = "journal_entry_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "journal_entry_id", nullable = false, updatable = false)
    private JournalEntryEntity journalEntry;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "account_code", nullable = false, updatable = false, length = 20)
    private String accountCode;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "debit_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal debitAmount;

    @Column(name = "credit_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal creditAmount;

    @Column(name = "counterpart_account", updatable = false, length = 20)
    private String counterpartAccount;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(updatable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", updatable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "exchange_rate", updatable = false, precision = 19, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "foreign_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal foreignAmount;

    @Column(name = "foreign_currency", updatable = false, length = 3)
    private String foreignCurrency;

    @Column(name = "tax_code", updatable = false, length = 20)
    private String taxCode;

    @Column(name = "tax_rate", updatable = false, precision = 7, scale = 4)
    private BigDecimal taxRate;

    @Column(name = "object_code", updatable = false, length = 50)
    private String objectCode;

    @Column(name = "object_type", updatable = false, length = 10)
    private String objectType;

    @Column(name = "contract_code", updatable = false, length = 50)
    private String contractCode;

    static JournalEntryLineEntity fromDomain(JournalEntryEntity entry, int lineNumber, VoucherLineDetail line) {
        JournalEntryLineEntity entity = new JournalEntryLineEntity();
        entity.id = UUID.randomUUID();
        entity.journalEntry = entry;
        entity.lineNumber = lineNumber;
        entity.accountCode = line.getAccountCode();
        entity.currency = currencyOf(line);
        entity.debitAmount = line.getDebitAmount() != null ? line.getDebitAmount().getAmount() : null;
        entity.creditAmount = line.getCreditAmount() != null ? line.getCreditAmount().getAmount() : null;
        entity.counterpartAccount = line.getCounterpartAccount();
        entity.description = line.getDescription();
        entity.quantity = line.getQuantity();
        entity.unitPrice = line.getUnitPrice();
        entity.exchangeRate = line.getExchangeRate();
        if (line.getForeignAmount() != null) {
            entity.foreignAmount = line.getForeignAmount().getAmount();
            entity.foreignCurrency = line.getForeignAmount().getCurrency();
        }
        entity.taxCode = line.getTaxCode();
        entity.taxRate = line.getTaxRate();
        entity.objectCode = line.getObjectCode();
        entity.objectType = line.getObjectType();
        entity.contractCode = line.getContractCode();
        return entity;
    }

    public VoucherLineDetail toDomain() {
        return VoucherLineDetail.builder()
                .accountCode(accountCode)
                .debitAmount(debitAmount != null ? Money.of(debitAmount, currency) : null)
                .creditAmount(creditAmount != null ? Money.of(creditAmount, currency) : null)
                .counterpartAccount(counterpartAccount)
                .description(description)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .exchangeRate(exchangeRate)
                .foreignAmount(foreignAmount != null ? Money.of(foreignAmount, foreignCurrency) : null)
                .taxCode(taxCode)
                .taxRate(taxRate)
                .objectCode(objectCode)
                .objectType(objectType)
                .contractCode(contractCode)
                .build();
    }

    private static String currencyOf(VoucherLineDetail line) {
        if (line.getDebitAmount() != null) {
            return line.getDebitAmount().getCurrency();
        }
        if (line.getCreditAmount() != null) {
            return line.getCreditAmount().getCurrency();
        }
        return Money.VND;
    }
}
