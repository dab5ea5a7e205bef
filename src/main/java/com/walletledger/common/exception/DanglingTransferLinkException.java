package com.walletledger.common.exception;

/**
 * Thrown when a record points to a transfer that does not exist.
 */
public class DanglingTransferLinkException extends IntegrityException {

    public DanglingTransferLinkException(long recordId, long transferId) {
        super(String.format("Dangling transfer link in record #%d: transfer #%d does not exist",
            recordId, transferId));
    }
}
