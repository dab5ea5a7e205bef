package com.walletledger.records;

import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.LedgerDates;
import com.walletledger.common.exception.RecordNotFoundException;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.common.exception.WalletNotFoundException;
import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.wallets.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Service for recurring expense templates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MandatoryExpenseService {

    private final LedgerRepository repository;
    private final CurrencyRateProvider rateProvider;

    public MandatoryExpenseRecord addTemplate(long walletId, double amount, String currency, String category,
                                              String description, MandatoryPeriod period) {
        if (amount < 0) {
            throw new ValidationException("Amount must not be negative");
        }
        if (repository.loadWallets().stream().noneMatch(w -> w.getId() == walletId)) {
            throw new WalletNotFoundException(walletId);
        }
        String code = CurrencyCodes.normalize(currency);
        LedgerRecord template = LedgerRecord.builder()
            .type(RecordType.MANDATORY_EXPENSE)
            .walletId(walletId)
            .amountOriginal(amount)
            .currency(code)
            .amountKzt(rateProvider.convert(amount, code))
            .category(category)
            .description(description)
            .period(period)
            .build();
        MandatoryExpenseRecord stored = repository.saveMandatoryExpense((MandatoryExpenseRecord) template);
        log.info("Added {} mandatory expense #{} '{}': {} {}", period.getCode(), stored.getId(),
            stored.getCategory(), amount, code);
        return stored;
    }

    public List<MandatoryExpenseRecord> listTemplates() {
        return repository.loadMandatoryExpenses();
    }

    /**
     * Record the template at {@code index} as a dated expense on a wallet.
     */
    public LedgerRecord applyTemplate(int index, LocalDate date, long walletId) {
        LedgerDates.ensureNotFuture(date);
        List<MandatoryExpenseRecord> templates = repository.loadMandatoryExpenses();
        if (index < 0 || index >= templates.size()) {
            throw RecordNotFoundException.byIndex(index);
        }
        LedgerDataset dataset = repository.loadDataset();
        Wallet wallet = dataset.findWallet(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
        MandatoryExpenseRecord template = templates.get(index);
        RecordService.ensureFunds(wallet, dataset.getRecords(), template.getAmountKzt());

        LedgerRecord stored = repository.save(template.applyTo(date, walletId));
        log.info("Applied mandatory expense '{}' to wallet {} on {} as record #{}",
            template.getCategory(), walletId, date, stored.getId());
        return stored;
    }

    public void deleteTemplate(int index) {
        repository.deleteMandatoryExpenseByIndex(index);
    }

    public void deleteAllTemplates() {
        repository.deleteAllMandatoryExpenses();
        log.info("Deleted all mandatory expense templates");
    }
}
