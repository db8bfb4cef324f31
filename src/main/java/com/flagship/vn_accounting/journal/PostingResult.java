package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.account.Account;
import lombok.Value;

import java.util.List;

/**
 * A posted entry with the accounts it moved. Warnings are advisory.
 */
@Value
public class PostingResult {
    JournalEntry entry;
    List<Account> accounts;
    List<String> warnings;
}
