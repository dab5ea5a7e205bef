package com.walletledger.records;

import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.LedgerDates;
import com.walletledger.common.exception.DomainException;
import com.walletledger.common.exception.InsufficientFundsException;
import com.walletledger.common.exception.RecordNotFoundException;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.common.exception.WalletNotFoundException;
import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletBalances;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Service for user-entered income and expense records.
 *
 * Amounts are converted to the base currency at the current rate when the record is created.
 * Transfer legs are managed by {@link com.walletledger.transfers.TransferService} and cannot be edited here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordService {

    private final LedgerRepository repository;
    private final CurrencyRateProvider rateProvider;

    public LedgerRecord createIncome(long walletId, LocalDate date, double amount, String currency,
                                     String category, String description) {
        return createRecord(RecordType.INCOME, walletId, date, amount, currency, category, description);
    }

    public LedgerRecord createExpense(long walletId, LocalDate date, double amount, String currency,
                                      String category, String description) {
        return createRecord(RecordType.EXPENSE, walletId, date, amount, currency, category, description);
    }

    private LedgerRecord createRecord(RecordType type, long walletId, LocalDate date, double amount,
                                      String currency, String category, String description) {
        if (!(amount > 0)) {
            throw new ValidationException("Amount must be positive");
        }
        LedgerDates.ensureNotFuture(date);
        String code = CurrencyCodes.normalize(currency);
        double amountKzt = rateProvider.convert(amount, code);

        LedgerDataset dataset = repository.loadDataset();
        Wallet wallet = dataset.findWallet(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
        if (!wallet.isActive()) {
            throw new DomainException("Wallet " + walletId + " is not active");
        }
        if (type != RecordType.INCOME) {
            ensureFunds(wallet, dataset.getRecords(), amountKzt);
        }

        LedgerRecord record = LedgerRecord.builder()
            .type(type)
            .date(date)
            .walletId(walletId)
            .amountOriginal(amount)
            .currency(code)
            .amountKzt(amountKzt)
            .category(category)
            .description(description)
            .build();
        LedgerRecord stored = repository.save(record);
        log.info("Created {} #{}: wallet={}, amount={} {} ({} {})", type.getCode(), stored.getId(), walletId,
            amount, code, amountKzt, rateProvider.getBaseCurrency());
        return stored;
    }

    static void ensureFunds(Wallet wallet, List<LedgerRecord> records, double requiredKzt) {
        if (wallet.isAllowNegative()) {
            return;
        }
        double available = WalletBalances.balanceOf(wallet, records);
        if (available - requiredKzt < 0) {
            throw new InsufficientFundsException(wallet.getId(), requiredKzt, available);
        }
    }

    public List<LedgerRecord> listRecords() {
        return repository.loadAll();
    }

    public LedgerRecord getRecord(long recordId) {
        return repository.getById(recordId).orElseThrow(() -> RecordNotFoundException.byId(recordId));
    }

    /**
     * Correct the base currency amount of a record. The rate is re-derived from it.
     */
    public LedgerRecord updateAmountKzt(long recordId, double newAmountKzt) {
        LedgerRecord record = getRecord(recordId);
        if (record.isTransferLeg() || record.getCommissionForTransferId() != null) {
            throw new DomainException("Transfer-linked records cannot be edited");
        }
        LedgerRecord updated = record.withAmountKzt(newAmountKzt);
        repository.replace(updated);
        log.info("Updated record #{}: amount_kzt {} -> {}", recordId, record.getAmountKzt(), updated.getAmountKzt());
        return updated;
    }

    /**
     * Delete the record at a position of {@link #listRecords()}. Deleting a transfer leg
     * removes the whole transfer.
     */
    public void deleteRecord(int index) {
        repository.deleteByIndex(index);
        log.info("Deleted record at index {}", index);
    }

    public void deleteAllRecords() {
        repository.deleteAll();
        log.info("Deleted all records");
    }
}
