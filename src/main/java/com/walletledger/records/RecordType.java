package com.walletledger.records;

import com.walletledger.common.exception.ValidationException;

import java.util.Locale;

/**
 * Discriminant of the record sum type. The code is the value persisted in both stores.
 */
public enum RecordType {
    /**
     * Money coming into a wallet.
     */
    INCOME("income"),

    /**
     * Money leaving a wallet.
     */
    EXPENSE("expense"),

    /**
     * Recurring expense. Stored as an undated template and materialized into dated records.
     */
    MANDATORY_EXPENSE("mandatory_expense");

    private final String code;

    RecordType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RecordType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (RecordType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unsupported record type: '" + code + "'");
    }
}
