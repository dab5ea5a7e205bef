package com.walletledger.records;

import com.walletledger.common.Amounts;
import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * A single monetary movement on a wallet.
 *
 * Records are immutable. Amounts are kept as absolute values and the sign is taken from
 * the record type. {@code rateAtOperation} is always derived from the two amounts so that
 * {@code rateAtOperation * amountOriginal == amountKzt} holds for every stored record.
 *
 * An id of {@code 0} means the record has not been stored yet.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class LedgerRecord {

    public static final String DEFAULT_CATEGORY = "General";

    private final long id;
    private final LocalDate date;
    private final long walletId;
    private final Long transferId;
    private final Long commissionForTransferId;
    private final double amountOriginal;
    private final String currency;
    private final double rateAtOperation;
    private final double amountKzt;
    private final String category;
    private final String description;

    protected LedgerRecord(long id, LocalDate date, long walletId, Long transferId,
                           Long commissionForTransferId, double amountOriginal, String currency,
                           double amountKzt, String category, String description) {
        if (id < 0) {
            throw new ValidationException("Record id must not be negative: " + id);
        }
        if (date == null && !allowsMissingDate()) {
            throw new ValidationException("Record date is required");
        }
        if (walletId <= 0) {
            throw new ValidationException("Record wallet id must be positive: " + walletId);
        }
        if (transferId != null && transferId <= 0) {
            throw new ValidationException("Transfer id must be positive: " + transferId);
        }
        if (commissionForTransferId != null && commissionForTransferId <= 0) {
            throw new ValidationException("Commission transfer id must be positive: " + commissionForTransferId);
        }
        if (amountOriginal < 0 || Double.isNaN(amountOriginal) || Double.isInfinite(amountOriginal)) {
            throw new ValidationException("amount_original must be >= 0: " + amountOriginal);
        }
        if (Double.isNaN(amountKzt) || Double.isInfinite(amountKzt)) {
            throw new ValidationException("amount_kzt must be a finite number");
        }
        this.id = id;
        this.date = date;
        this.walletId = walletId;
        this.transferId = transferId;
        this.commissionForTransferId = commissionForTransferId;
        this.amountOriginal = amountOriginal;
        this.currency = CurrencyCodes.normalize(currency);
        this.amountKzt = Math.abs(amountKzt);
        this.rateAtOperation = deriveRate(this.currency, amountOriginal, this.amountKzt);
        this.category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
        this.description = description == null ? "" : description;
    }

    public abstract RecordType getType();

    /**
     * Only undated mandatory templates may be built without a date.
     */
    protected boolean allowsMissingDate() {
        return false;
    }

    /**
     * Rate of {@code currency} against the base currency at the time of the operation.
     */
    public static double deriveRate(String currency, double amountOriginal, double amountKzt) {
        if (CurrencyCodes.BASE.equals(currency) || amountOriginal == 0) {
            return 1.0;
        }
        return amountKzt / amountOriginal;
    }

    public boolean isIncome() {
        return getType() == RecordType.INCOME;
    }

    public boolean isTransferLeg() {
        return transferId != null;
    }

    /**
     * Contribution of this record to its wallet's balance.
     */
    public double signedAmountKzt() {
        return isIncome() ? amountKzt : -amountKzt;
    }

    /**
     * Returns a copy with a new base-currency amount, rounded to cents, and the rate
     * re-derived from it. Base currency records keep both amounts equal.
     */
    public LedgerRecord withAmountKzt(double newAmountKzt) {
        if (amountOriginal == 0) {
            throw new ValidationException("Cannot update amount: amount_original is 0");
        }
        double rounded = Amounts.round2(Math.abs(newAmountKzt));
        LedgerRecordBuilder builder = toBuilder().amountKzt(rounded);
        if (CurrencyCodes.BASE.equals(currency)) {
            builder.amountOriginal(rounded);
        }
        return builder.build();
    }

    public LedgerRecord withId(long newId) {
        return toBuilder().id(newId).build();
    }

    public LedgerRecord withWalletId(long newWalletId) {
        return toBuilder().walletId(newWalletId).build();
    }

    public LedgerRecord withTransferId(Long newTransferId) {
        return toBuilder().transferId(newTransferId).build();
    }

    public LedgerRecord withCommissionForTransferId(Long newTransferId) {
        return toBuilder().commissionForTransferId(newTransferId).build();
    }

    public LedgerRecordBuilder toBuilder() {
        return builder()
            .type(getType())
            .id(id)
            .date(date)
            .walletId(walletId)
            .transferId(transferId)
            .commissionForTransferId(commissionForTransferId)
            .amountOriginal(amountOriginal)
            .currency(currency)
            .amountKzt(amountKzt)
            .category(category)
            .description(description)
            .period(this instanceof MandatoryExpenseRecord
                ? ((MandatoryExpenseRecord) this).getPeriod() : null);
    }

    @Builder
    private static LedgerRecord create(RecordType type, long id, LocalDate date, long walletId,
                                       Long transferId, Long commissionForTransferId,
                                       double amountOriginal, String currency, double amountKzt,
                                       String category, String description, MandatoryPeriod period) {
        if (type == null) {
            throw new ValidationException("Record type is required");
        }
        return switch (type) {
            case INCOME -> new IncomeRecord(id, date, walletId, transferId, commissionForTransferId,
                amountOriginal, currency, amountKzt, category, description);
            case EXPENSE -> new ExpenseRecord(id, date, walletId, transferId, commissionForTransferId,
                amountOriginal, currency, amountKzt, category, description);
            case MANDATORY_EXPENSE -> new MandatoryExpenseRecord(id, date, walletId, transferId,
                commissionForTransferId, amountOriginal, currency, amountKzt, category, description, period);
        };
    }
}
