package com.walletledger.records;

import com.walletledger.common.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * A recurring expense.
 *
 * Kept undated as a template in the mandatory expense list, and materialized as a dated
 * record when the user applies it to a wallet.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MandatoryExpenseRecord extends LedgerRecord {

    private final MandatoryPeriod period;

    public MandatoryExpenseRecord(long id, LocalDate date, long walletId, Long transferId,
                                  Long commissionForTransferId, double amountOriginal, String currency,
                                  double amountKzt, String category, String description,
                                  MandatoryPeriod period) {
        super(id, date, walletId, transferId, commissionForTransferId, amountOriginal, currency,
            amountKzt, category, description);
        if (period == null) {
            throw new ValidationException("Mandatory expense period is required");
        }
        this.period = period;
    }

    @Override
    public RecordType getType() {
        return RecordType.MANDATORY_EXPENSE;
    }

    @Override
    protected boolean allowsMissingDate() {
        return true;
    }

    /**
     * Materializes this template as a dated record on the given wallet.
     */
    public MandatoryExpenseRecord applyTo(LocalDate onDate, long targetWalletId) {
        return (MandatoryExpenseRecord) toBuilder()
            .id(0)
            .date(onDate)
            .walletId(targetWalletId)
            .build();
    }
}
