package com.walletledger.imports;

/**
 * Rules for which amount fields an import row must supply and how the base currency
 * amount is obtained.
 */
public enum ImportPolicy {
    /**
     * Rows carry {@code amount_original}, {@code currency}, {@code rate_at_operation} and
     * {@code amount_kzt}, as written by a full export.
     */
    FULL_BACKUP,

    /**
     * Rows carry {@code amount_original} and {@code currency}. The base amount is computed
     * at today's rate.
     */
    CURRENT_RATE,

    /**
     * Rows carry a bare {@code amount} in the base currency.
     */
    LEGACY
}
