package com.flagship.vn_accounting.exception;

/**
 * Thrown on a second attempt to post the same journal entry.
 */
public class AlreadyPostedException extends AccountingException {

    private final String entryNumber;

    public AlreadyPostedException(String entryNumber) {
        super("ALREADY_POSTED", String.format("Journal entry %s has already been posted", entryNumber));
        this.entryNumber = entryNumber;
    }

    public String getEntryNumber() {
        return entryNumber;
    }
}
