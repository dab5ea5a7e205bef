package com.walletledger.common.exception;

/**
 * Base exception for all wallet ledger exceptions.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
