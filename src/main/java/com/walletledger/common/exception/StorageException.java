package com.walletledger.common.exception;

/**
 * Thrown when a store cannot be read or written.
 */
public class StorageException extends LedgerException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
