package com.walletledger.common.exception;

/**
 * Thrown when a transfer is not found.
 */
public class TransferNotFoundException extends DomainException {

    public TransferNotFoundException(long transferId) {
        super("Transfer not found: " + transferId);
    }
}
