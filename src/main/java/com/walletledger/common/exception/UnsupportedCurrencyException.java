package com.walletledger.common.exception;

/**
 * Thrown when no rate is known for a currency.
 */
public class UnsupportedCurrencyException extends ValidationException {

    public UnsupportedCurrencyException(String currency) {
        super("Unsupported currency: " + currency);
    }
}
