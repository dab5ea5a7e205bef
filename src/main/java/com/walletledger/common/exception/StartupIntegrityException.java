package com.walletledger.common.exception;

/**
 * Thrown when the stores disagree at startup and the application must not open either of them.
 */
public class StartupIntegrityException extends LedgerException {

    public StartupIntegrityException(String message) {
        super(message);
    }

    public StartupIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
