package com.walletledger.common.exception;

/**
 * Thrown when a wallet is not found.
 */
public class WalletNotFoundException extends DomainException {

    public WalletNotFoundException(long walletId) {
        super("Wallet not found: " + walletId);
    }
}
