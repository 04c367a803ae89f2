package com.flagship.value_ledger.rewards;

import java.util.Locale;

public enum RewardType {
    VOUCHER,
    PRODUCT,
    EXPERIENCE,
    CASHBACK;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RewardType fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * What the member does with the redemption code.
     */
    public String instructions(String redemptionCode) {
        return switch (this) {
            case VOUCHER -> "Show this code (" + redemptionCode
                    + ") to the merchant when making a purchase. Valid for single use only.";
            case PRODUCT -> "Present this code (" + redemptionCode
                    + ") at the merchant location to claim your product. Valid for 30 days.";
            case EXPERIENCE -> "Contact the merchant to schedule your experience. Reference code: "
                    + redemptionCode + ". Valid for 90 days.";
            case CASHBACK -> "Your cashback has been applied to your wallet automatically. Reference: "
                    + redemptionCode;
        };
    }
}
