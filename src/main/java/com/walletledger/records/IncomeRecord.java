package com.walletledger.records;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Money received into a wallet.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class IncomeRecord extends LedgerRecord {

    public IncomeRecord(long id, LocalDate date, long walletId, Long transferId,
                        Long commissionForTransferId, double amountOriginal, String currency,
                        double amountKzt, String category, String description) {
        super(id, date, walletId, transferId, commissionForTransferId, amountOriginal, currency,
            amountKzt, category, description);
    }

    @Override
    public RecordType getType() {
        return RecordType.INCOME;
    }
}
