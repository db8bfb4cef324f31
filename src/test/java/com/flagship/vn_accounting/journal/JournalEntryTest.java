package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.exception.AlreadyPostedException;
import com.flagship.vn_accounting.exception.CurrencyMismatchException;
import com.flagship.vn_accounting.exception.JournalEntryNotBalancedException;
import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.period.LockStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 15);

    private JournalEntry entry(VoucherLineDetail... lines) {
        return JournalEntry.create("BT/20240315/001", UUID.randomUUID(), "DEMO",
                DATE, null, "Test entry", List.of(lines), "tester");
    }

    @Test
    @DisplayName("Totals are summed from the lines and the entry is balanced")
    void testCreate_Balanced() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("131", Money.vnd("11000000")),
            VoucherLineDetail.credit("5111", Money.vnd("10000000")),
            VoucherLineDetail.credit("3331", Money.vnd("1000000")));

        assertEquals(0, new BigDecimal("11000000").compareTo(entry.getTotalDebit().getAmount()));
        assertEquals(0, new BigDecimal("11000000").compareTo(entry.getTotalCredit().getAmount()));
        assertTrue(entry.getDifference().isZero());
        assertTrue(entry.isBalanced());
        assertEquals(DATE, entry.getPostingDate());
        assertEquals(LockStatus.OPEN, entry.getLockStatus());
        assertFalse(entry.isPosted());
    }

    @Test
    @DisplayName("Balance comparison is exact and ignores scale")
    void testIsBalanced_ScaleInsensitive() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("1111", Money.vnd("100.00")),
            VoucherLineDetail.credit("511", Money.vnd("100")));
        assertTrue(entry.isBalanced());

        JournalEntry offByOneDong = entry(
            VoucherLineDetail.debit("1111", Money.vnd("100.01")),
            VoucherLineDetail.credit("511", Money.vnd("100")));
        assertFalse(offByOneDong.isBalanced());
    }

    @Test
    @DisplayName("An entry without lines totals zero on both sides")
    void testCreate_NoLines() {
        JournalEntry entry = entry();
        assertTrue(entry.getTotalDebit().isZero());
        assertTrue(entry.isBalanced());
    }

    @Test
    @DisplayName("Lines in a foreign currency cannot be totalled")
    void testCalculateTotals_ForeignCurrencyLine() {
        assertThrows(CurrencyMismatchException.class, () -> entry(
            VoucherLineDetail.debit("1122", Money.of("100", "USD")),
            VoucherLineDetail.credit("511", Money.vnd("2500000"))));
    }

    @Test
    @DisplayName("Posting an unbalanced entry fails and reports both totals")
    void testPost_Unbalanced() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("131", Money.vnd("11000000")),
            VoucherLineDetail.credit("5111", Money.vnd("10000000")));

        JournalEntryNotBalancedException e = assertThrows(JournalEntryNotBalancedException.class,
                () -> entry.post("accountant"));

        assertEquals("BT/20240315/001", e.getEntryNumber());
        assertEquals(0, new BigDecimal("11000000").compareTo(e.getTotalDebit()));
        assertEquals(0, new BigDecimal("10000000").compareTo(e.getTotalCredit()));
        assertEquals(0, new BigDecimal("1000000").compareTo(e.getDifference()));
        assertFalse(entry.isPosted());
    }

    @Test
    @DisplayName("Posting twice fails with AlreadyPostedException")
    void testPost_Twice() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("1111", Money.vnd("500000")),
            VoucherLineDetail.credit("511", Money.vnd("500000")));

        JournalEntry posted = entry.post("accountant");

        assertTrue(posted.isPosted());
        assertEquals("accountant", posted.getPostedBy());
        assertNotNull(posted.getPostedAt());
        assertEquals(entry.getVersion() + 1, posted.getVersion());
        assertThrows(AlreadyPostedException.class, () -> posted.post("accountant"));
    }

    @Test
    @DisplayName("Lock succeeds in any state and freezes the entry")
    void testLock() {
        JournalEntry unbalanced = entry(VoucherLineDetail.debit("1111", Money.vnd("1")));

        JournalEntry locked = unbalanced.lock(LockStatus.MONTH_LOCKED);

        assertTrue(locked.isLocked());
        assertFalse(locked.canModify());
        assertEquals(LockStatus.MONTH_LOCKED, locked.getLockStatus());
        assertTrue(unbalanced.canModify());
    }

    @Test
    @DisplayName("Locking an already locked entry succeeds and bumps the version each time")
    void testLock_AlreadyLocked() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("1111", Money.vnd("500000")),
            VoucherLineDetail.credit("511", Money.vnd("500000")));
        JournalEntry monthLocked = entry.lock(LockStatus.MONTH_LOCKED);

        JournalEntry yearLocked = monthLocked.lock(LockStatus.YEAR_LOCKED);

        assertTrue(yearLocked.isLocked());
        assertFalse(yearLocked.canModify());
        assertEquals(LockStatus.YEAR_LOCKED, yearLocked.getLockStatus());
        assertEquals(entry.getVersion() + 1, monthLocked.getVersion());
        assertEquals(monthLocked.getVersion() + 1, yearLocked.getVersion());
    }

    @Test
    @DisplayName("A posted entry can be locked and stays posted")
    void testLock_Posted() {
        JournalEntry entry = entry(
            VoucherLineDetail.debit("1111", Money.vnd("500000")),
            VoucherLineDetail.credit("511", Money.vnd("500000")));
        JournalEntry posted = entry.post("accountant");

        JournalEntry locked = posted.lock(LockStatus.FINALIZED);

        assertTrue(locked.isLocked());
        assertTrue(locked.isPosted());
        assertFalse(locked.canModify());
        assertEquals(LockStatus.FINALIZED, locked.getLockStatus());
        assertEquals(posted.getVersion() + 1, locked.getVersion());
    }
}
