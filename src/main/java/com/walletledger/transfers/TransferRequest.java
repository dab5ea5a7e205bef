package com.walletledger.transfers;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Request to move money between two wallets.
 * The commission is charged to the source wallet as a separate expense.
 */
@Value
@Builder
public class TransferRequest {
    long fromWalletId;
    long toWalletId;
    LocalDate date;
    double amount;
    String currency;
    double commission;

    /**
     * Defaults to the transfer currency.
     */
    String commissionCurrency;

    String description;
}
