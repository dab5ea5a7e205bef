package com.walletledger.transfers;

import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.records.LedgerRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Movement of money between two wallets.
 *
 * A stored transfer is always backed by exactly two records linked through
 * {@code transferId}: an expense on the source wallet and an income on the destination.
 */
@Value
public class Transfer {

    long id;
    long fromWalletId;
    long toWalletId;
    LocalDate date;
    double amountOriginal;
    String currency;
    double rateAtOperation;
    double amountKzt;
    String description;

    @Builder(toBuilder = true)
    public Transfer(long id, long fromWalletId, long toWalletId, LocalDate date, double amountOriginal,
                    String currency, double amountKzt, String description) {
        if (id <= 0) {
            throw new ValidationException("Transfer id must be positive: " + id);
        }
        if (fromWalletId <= 0 || toWalletId <= 0) {
            throw new ValidationException("Transfer wallet ids must be positive");
        }
        if (fromWalletId == toWalletId) {
            throw new ValidationException("Source and destination wallets must be different");
        }
        if (date == null) {
            throw new ValidationException("Transfer date is required");
        }
        if (!(amountOriginal > 0) || !(amountKzt > 0)) {
            throw new ValidationException("Transfer amount must be positive");
        }
        this.id = id;
        this.fromWalletId = fromWalletId;
        this.toWalletId = toWalletId;
        this.date = date;
        this.amountOriginal = amountOriginal;
        this.currency = CurrencyCodes.normalize(currency);
        this.amountKzt = amountKzt;
        this.rateAtOperation = LedgerRecord.deriveRate(this.currency, amountOriginal, amountKzt);
        this.description = description == null ? "" : description;
    }
}
