package com.walletledger.common.exception;

/**
 * Thrown when a value cannot be accepted as input: a malformed date, currency code,
 * period or amount.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
