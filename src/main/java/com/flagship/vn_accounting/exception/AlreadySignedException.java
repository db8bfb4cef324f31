package com.flagship.vn_accounting.exception;

/**
 * Thrown on a second attempt to sign the same voucher.
 */
public class AlreadySignedException extends AccountingException {

    private final String voucherNumber;

    public AlreadySignedException(String voucherNumber) {
        super("ALREADY_SIGNED", String.format("Voucher %s has already been signed", voucherNumber));
        this.voucherNumber = voucherNumber;
    }

    public String getVoucherNumber() {
        return voucherNumber;
    }
}
