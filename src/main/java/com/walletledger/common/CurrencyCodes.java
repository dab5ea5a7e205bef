package com.walletledger.common;

import com.walletledger.common.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Currency codes are kept as plain upper-case three letter strings so that any
 * ISO 4217 code configured with a rate can be stored.
 */
public final class CurrencyCodes {

    /** Currency that {@code amount_kzt} values are expressed in. */
    public static final String BASE = "KZT";

    private static final Pattern CODE = Pattern.compile("[A-Za-z]{3}");

    private CurrencyCodes() {
    }

    public static boolean isValid(String code) {
        return code != null && CODE.matcher(code.trim()).matches();
    }

    public static String normalize(String code) {
        if (!isValid(code)) {
            throw new ValidationException("Invalid currency code: '" + code + "'");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
