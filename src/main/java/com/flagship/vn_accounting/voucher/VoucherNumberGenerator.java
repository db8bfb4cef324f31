package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.journal.JournalEntryPersistenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Assigns {@code PREFIX/YYYYMMDD/NNN} numbers, NNN being the count of
 * numbers already issued for that date plus one.
 *
 * Two concurrent creations on the same date can draw the same number; the
 * unique constraint rejects the loser.
 */
@Component
@RequiredArgsConstructor
public class VoucherNumberGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final VoucherPersistenceService voucherPersistenceService;
    private final JournalEntryPersistenceService journalEntryPersistenceService;

    @Value("${accounting.numbering.voucher-prefix:CT}")
    private String voucherPrefix;

    @Value("${accounting.numbering.entry-prefix:BT}")
    private String entryPrefix;

    public String nextVoucherNumber(LocalDate voucherDate) {
        String prefix = prefixFor(voucherPrefix, voucherDate);
        return format(prefix, voucherPersistenceService.countByNumberPrefix(prefix) + 1);
    }

    public String nextEntryNumber(LocalDate voucherDate) {
        String prefix = prefixFor(entryPrefix, voucherDate);
        return format(prefix, journalEntryPersistenceService.countByNumberPrefix(prefix) + 1);
    }

    static String prefixFor(String prefix, LocalDate date) {
        return prefix + "/" + date.format(DATE_FORMAT) + "/";
    }

    static String format(String datedPrefix, long sequence) {
        return datedPrefix + String.format("%03d", sequence);
    }
}
