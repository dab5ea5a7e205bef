package com.walletledger.wallets;

import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

/**
 * A wallet holding money in one currency.
 *
 * The balance is never stored: it is derived from {@code initialBalance} and the
 * wallet's records. Soft-deleted wallets keep {@code active == false} and stay in the store.
 */
@Value
public class Wallet {

    public static final long SYSTEM_WALLET_ID = 1L;

    long id;
    String name;
    String currency;
    double initialBalance;
    boolean system;
    boolean allowNegative;
    boolean active;

    @Builder(toBuilder = true)
    public Wallet(long id, String name, String currency, double initialBalance,
                  boolean system, boolean allowNegative, Boolean active) {
        if (id <= 0) {
            throw new ValidationException("Wallet id must be positive: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Wallet name must not be empty");
        }
        this.id = id;
        this.name = name.trim();
        this.currency = CurrencyCodes.normalize(currency);
        this.initialBalance = initialBalance;
        this.system = system;
        this.allowNegative = allowNegative;
        this.active = active == null || active;
    }

    /**
     * The wallet created implicitly when a store has none.
     */
    public static Wallet systemDefault(double initialBalance) {
        return Wallet.builder()
            .id(SYSTEM_WALLET_ID)
            .name("Main wallet")
            .currency(CurrencyCodes.BASE)
            .initialBalance(initialBalance)
            .system(true)
            .allowNegative(false)
            .active(true)
            .build();
    }

    public Wallet deactivate() {
        return toBuilder().active(false).build();
    }
}
