package com.walletledger.common.exception;

/**
 * Thrown when a transfer is not backed by exactly one expense leg and one income leg.
 */
public class BrokenTransferPairException extends IntegrityException {

    public BrokenTransferPairException(long transferId, String reason) {
        super(String.format("Transfer integrity violated for #%d: %s", transferId, reason));
    }
}
