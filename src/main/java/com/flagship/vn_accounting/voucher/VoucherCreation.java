package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.journal.JournalEntry;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a create call. {@code replayed} is true when the idempotency
 * key matched an earlier voucher and nothing new was written.
 */
@Value
public class VoucherCreation {
    AccountingVoucher voucher;
    List<JournalEntry> entries;
    boolean replayed;
}
