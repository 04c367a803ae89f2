package com.flagship.value_ledger.wallet;

import java.util.Locale;

public enum VoucherStatus {
    ACTIVE,
    INACTIVE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VoucherStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
