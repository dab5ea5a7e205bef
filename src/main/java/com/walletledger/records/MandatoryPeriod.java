package com.walletledger.records;

import com.walletledger.common.exception.ValidationException;

import java.util.Locale;

/**
 * How often a mandatory expense recurs.
 */
public enum MandatoryPeriod {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String code;

    MandatoryPeriod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static MandatoryPeriod fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (MandatoryPeriod period : values()) {
                if (period.code.equals(normalized)) {
                    return period;
                }
            }
        }
        throw new ValidationException("Invalid mandatory period: '" + code + "'");
    }
}
