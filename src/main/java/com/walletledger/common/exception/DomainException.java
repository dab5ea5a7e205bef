package com.walletledger.common.exception;

/**
 * Thrown when an operation is well-formed but not allowed by the current ledger state.
 */
public class DomainException extends LedgerException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
