package com.flagship.vn_accounting.period;

import com.flagship.vn_accounting.exception.EntityLockedException;
import com.flagship.vn_accounting.exception.FinancialPeriodClosedException;
import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.journal.JournalPostingService;
import com.flagship.vn_accounting.journal.VoucherLineDetail;
import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.voucher.AccountingVoucher;
import com.flagship.vn_accounting.voucher.VoucherCreation;
import com.flagship.vn_accounting.voucher.VoucherDraft;
import com.flagship.vn_accounting.voucher.VoucherService;
import com.flagship.vn_accounting.voucher.VoucherType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Period-end locking. Each test works in its own year so locks do not leak between tests.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PeriodLockServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("vn_accounting_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topic.create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private PeriodLockService periodLockService;

    @Autowired
    private FiscalPeriodService fiscalPeriodService;

    @Autowired
    private VoucherService voucherService;

    @Autowired
    private JournalPostingService journalPostingService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private VoucherDraft cashSale(LocalDate date) {
        return VoucherDraft.builder()
                .voucherType(VoucherType.CASH_RECEIPT)
                .voucherDate(date)
                .line(VoucherLineDetail.debit("1111", Money.vnd("2000000")))
                .line(VoucherLineDetail.credit("511", Money.vnd("2000000")))
                .build();
    }

    @Test
    @DisplayName("Locking a month freezes its vouchers and entries and leaves other months open")
    void testLockMonth() {
        printTestHeader("Lock Month");
        AccountingVoucher inside = voucherService.createVoucher(
            cashSale(LocalDate.of(2031, 3, 10)), null, "cashier").getVoucher();
        AccountingVoucher outside = voucherService.createVoucher(
            cashSale(LocalDate.of(2031, 4, 1)), null, "cashier").getVoucher();

        PeriodLockResult result = periodLockService.lockPeriod(PeriodType.MONTH, 2031, 3, "controller");

        printOutput("Period", result.getPeriod().getName());
        printOutput("Vouchers locked", result.getVouchersLocked());

        assertFalse(result.isAlreadyLocked());
        assertEquals("2031-03", result.getPeriod().getName());
        assertEquals(LockStatus.MONTH_LOCKED, result.getPeriod().getLockStatus());
        assertEquals("controller", result.getPeriod().getLockedBy());
        assertEquals(1, result.getVouchersLocked());
        assertEquals(0, result.getEntriesLocked());

        AccountingVoucher lockedVoucher = voucherService.getVoucher(inside.getId());
        assertTrue(lockedVoucher.isLocked());
        assertEquals(LockStatus.MONTH_LOCKED, lockedVoucher.getLockStatus());
        voucherService.getJournalEntries(inside.getId())
                .forEach(entry -> assertEquals(LockStatus.MONTH_LOCKED, entry.getLockStatus()));

        assertFalse(voucherService.getVoucher(outside.getId()).isLocked());
        assertFalse(fiscalPeriodService.isPeriodOpen(LocalDate.of(2031, 3, 31)));
        assertTrue(fiscalPeriodService.isPeriodOpen(LocalDate.of(2031, 4, 1)));
    }

    @Test
    @DisplayName("Vouchers dated in a locked period are rejected")
    void testCreateVoucher_InLockedPeriod() {
        printTestHeader("Create Voucher In Locked Period");
        periodLockService.lockPeriod(PeriodType.QUARTER, 2032, 2, "controller");

        FinancialPeriodClosedException e = assertThrows(FinancialPeriodClosedException.class,
                () -> voucherService.createVoucher(cashSale(LocalDate.of(2032, 5, 15)), null, "cashier"));
        printExpectedException("FinancialPeriodClosedException", e.getMessage());

        assertEquals("2032-Q2", e.getPeriodName());
        assertTrue(voucherService.listVouchers(LocalDate.of(2032, 4, 1), LocalDate.of(2032, 6, 30), null, 0, 50)
                .isEmpty());
    }

    @Test
    @DisplayName("A posting date inside a locked period is rejected even if the voucher date is open")
    void testCreateVoucher_PostingDateInLockedPeriod() {
        periodLockService.lockPeriod(PeriodType.MONTH, 2033, 1, "controller");
        VoucherDraft draft = cashSale(LocalDate.of(2033, 2, 3)).toBuilder()
                .postingDate(LocalDate.of(2033, 1, 31))
                .build();

        assertThrows(FinancialPeriodClosedException.class,
                () -> voucherService.createVoucher(draft, null, "cashier"));
    }

    @Test
    @DisplayName("Locking an already locked period changes nothing")
    void testLockPeriod_AlreadyLocked() {
        voucherService.createVoucher(cashSale(LocalDate.of(2034, 6, 1)), null, "cashier");
        PeriodLockResult first = periodLockService.lockPeriod(PeriodType.YEAR, 2034, 0, "controller");

        PeriodLockResult second = periodLockService.lockPeriod(PeriodType.YEAR, 2034, 0, "someone-else");

        assertFalse(first.isAlreadyLocked());
        assertEquals(1, first.getVouchersLocked());
        assertEquals(LockStatus.YEAR_LOCKED, first.getPeriod().getLockStatus());
        assertTrue(second.isAlreadyLocked());
        assertEquals(0, second.getVouchersLocked());
        assertEquals("controller", second.getPeriod().getLockedBy());
    }

    @Test
    @DisplayName("A wider lock keeps the status of vouchers locked by a narrower one")
    void testLockPeriod_KeepsEarlierStatus() {
        VoucherCreation march = voucherService.createVoucher(cashSale(LocalDate.of(2035, 3, 5)), null, "cashier");
        VoucherCreation february = voucherService.createVoucher(cashSale(LocalDate.of(2035, 2, 5)), null, "cashier");
        periodLockService.lockPeriod(PeriodType.MONTH, 2035, 3, "controller");

        PeriodLockResult quarter = periodLockService.lockPeriod(PeriodType.QUARTER, 2035, 1, "controller");

        assertEquals(1, quarter.getVouchersLocked());
        assertEquals(LockStatus.MONTH_LOCKED, voucherService.getVoucher(march.getVoucher().getId()).getLockStatus());
        assertEquals(LockStatus.QUARTER_LOCKED,
                voucherService.getVoucher(february.getVoucher().getId()).getLockStatus());
    }

    @Test
    @DisplayName("Entries frozen by a period lock cannot be posted")
    void testPostEntry_AfterPeriodLocked() {
        JournalEntry entry = voucherService.createVoucher(cashSale(LocalDate.of(2036, 7, 7)), null, "cashier")
                .getEntries().get(0);
        periodLockService.lockPeriod(PeriodType.MONTH, 2036, 7, "controller");

        assertThrows(EntityLockedException.class,
                () -> journalPostingService.postEntry(entry.getId(), "chief-accountant"));
        assertFalse(journalPostingService.getEntry(entry.getId()).isPosted());
    }

    @Test
    @DisplayName("Periods of a year are listed in date order")
    void testListPeriods() {
        periodLockService.lockPeriod(PeriodType.MONTH, 2037, 5, "controller");
        periodLockService.lockPeriod(PeriodType.MONTH, 2037, 2, "controller");

        List<FiscalPeriod> periods = fiscalPeriodService.listPeriods(2037);

        assertEquals(List.of("2037-02", "2037-05"), periods.stream().map(FiscalPeriod::getName).toList());
        assertTrue(periods.stream().allMatch(FiscalPeriod::isLocked));
    }
}
