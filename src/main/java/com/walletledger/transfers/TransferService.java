package com.walletledger.transfers;

import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.LedgerDates;
import com.walletledger.common.exception.DomainException;
import com.walletledger.common.exception.InsufficientFundsException;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.common.exception.WalletNotFoundException;
import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerMutations;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletBalances;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for wallet-to-wallet transfers.
 *
 * A transfer is written together with its expense leg, its income leg and an optional
 * commission expense in a single bulk write, so the store never holds half a transfer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    public static final String TRANSFER_CATEGORY = "Transfer";
    public static final String COMMISSION_CATEGORY = "Commission";

    private final LedgerRepository repository;
    private final CurrencyRateProvider rateProvider;

    public Transfer createTransfer(TransferRequest request) {
        if (request.getFromWalletId() == request.getToWalletId()) {
            throw new ValidationException("Source and destination wallets must be different");
        }
        if (!(request.getAmount() > 0)) {
            throw new ValidationException("Transfer amount must be positive");
        }
        if (request.getCommission() < 0) {
            throw new ValidationException("Commission cannot be negative");
        }
        if (request.getDate() == null) {
            throw new ValidationException("Transfer date is required");
        }
        LedgerDates.ensureNotFuture(request.getDate());

        LedgerDataset dataset = repository.loadDataset();
        Wallet from = activeWallet(dataset, request.getFromWalletId());
        Wallet to = activeWallet(dataset, request.getToWalletId());

        String currency = CurrencyCodes.normalize(request.getCurrency());
        double amountKzt = rateProvider.convert(request.getAmount(), currency);
        String commissionCurrency = request.getCommissionCurrency() == null
            ? currency : CurrencyCodes.normalize(request.getCommissionCurrency());
        double commissionKzt = request.getCommission() > 0
            ? rateProvider.convert(request.getCommission(), commissionCurrency) : 0.0;

        // Checked before anything is written
        if (!from.isAllowNegative()) {
            double available = WalletBalances.balanceOf(from, dataset.getRecords());
            if (available - amountKzt - commissionKzt < 0) {
                throw new InsufficientFundsException(from.getId(), amountKzt + commissionKzt, available);
            }
        }

        long transferId = LedgerMutations.nextId(dataset.getTransfers(), Transfer::getId);
        long recordId = LedgerMutations.nextId(dataset.getRecords(), LedgerRecord::getId);
        String description = request.getDescription() == null ? "" : request.getDescription();

        Transfer transfer = Transfer.builder()
            .id(transferId)
            .fromWalletId(from.getId())
            .toWalletId(to.getId())
            .date(request.getDate())
            .amountOriginal(request.getAmount())
            .currency(currency)
            .amountKzt(amountKzt)
            .description(description)
            .build();

        List<LedgerRecord> records = new ArrayList<>(dataset.getRecords());
        records.add(leg(RecordType.EXPENSE, recordId++, transfer, from.getId()));
        records.add(leg(RecordType.INCOME, recordId++, transfer, to.getId()));
        if (commissionKzt > 0) {
            records.add(LedgerRecord.builder()
                .type(RecordType.EXPENSE)
                .id(recordId)
                .date(request.getDate())
                .walletId(from.getId())
                .commissionForTransferId(transferId)
                .amountOriginal(request.getCommission())
                .currency(commissionCurrency)
                .amountKzt(commissionKzt)
                .category(COMMISSION_CATEGORY)
                .description(description)
                .build());
        }
        List<Transfer> transfers = new ArrayList<>(dataset.getTransfers());
        transfers.add(transfer);

        repository.replaceRecordsAndTransfers(records, transfers);
        log.info("Created transfer #{}: {} -> {}, amount={} {} ({}), commission={}",
            transferId, from.getId(), to.getId(), request.getAmount(), currency, amountKzt, commissionKzt);
        return transfer;
    }

    private static LedgerRecord leg(RecordType type, long id, Transfer transfer, long walletId) {
        return LedgerRecord.builder()
            .type(type)
            .id(id)
            .date(transfer.getDate())
            .walletId(walletId)
            .transferId(transfer.getId())
            .amountOriginal(transfer.getAmountOriginal())
            .currency(transfer.getCurrency())
            .amountKzt(transfer.getAmountKzt())
            .category(TRANSFER_CATEGORY)
            .description(transfer.getDescription())
            .build();
    }

    private static Wallet activeWallet(LedgerDataset dataset, long walletId) {
        Wallet wallet = dataset.findWallet(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
        if (!wallet.isActive()) {
            throw new DomainException("Wallet " + walletId + " is not active");
        }
        return wallet;
    }

    public List<Transfer> listTransfers() {
        return repository.loadTransfers();
    }

    /**
     * Delete a transfer together with both legs and its commission.
     *
     * @throws com.walletledger.common.exception.TransferNotFoundException if the transfer does not exist
     */
    public void deleteTransfer(long transferId) {
        repository.deleteTransfer(transferId);
        log.info("Deleted transfer #{}", transferId);
    }
}
