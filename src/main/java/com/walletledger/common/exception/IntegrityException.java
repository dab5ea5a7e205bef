package com.walletledger.common.exception;

/**
 * Thrown when stored data violates the transfer double-entry rules.
 * Raised on load as well as on write, so a corrupted store cannot be opened silently.
 */
public class IntegrityException extends DomainException {

    public IntegrityException(String message) {
        super(message);
    }
}
