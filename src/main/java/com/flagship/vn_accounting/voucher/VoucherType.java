package com.flagship.vn_accounting.voucher;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Voucher kinds from Appendix I, with their statutory short codes.
 */
public enum VoucherType {
    CASH_RECEIPT("THU"),
    CASH_PAYMENT("CHI"),
    IMPORT("NKC"),
    EXPORT("XK"),
    PURCHASE("MUA"),
    SALE("BAN"),
    SHORTAGE_FOUND("KPH"),
    SURPLUS_FOUND("KPD"),
    ADJUSTMENT("DIEU_CHINH"),
    OTHER("KHAC");

    private final String code;

    VoucherType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts either the enum name or the short code.
     */
    @JsonCreator
    public static VoucherType fromCode(String value) {
        for (VoucherType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown voucher type: " + value);
    }
}
