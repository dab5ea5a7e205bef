package com.walletledger.common.exception;

/**
 * Thrown when a wallet that does not allow a negative balance cannot cover an operation.
 */
public class InsufficientFundsException extends DomainException {

    public InsufficientFundsException(long walletId, double required, double available) {
        super(String.format("Insufficient funds in wallet %d. Required: %.2f, Available: %.2f",
            walletId, required, available));
    }
}
