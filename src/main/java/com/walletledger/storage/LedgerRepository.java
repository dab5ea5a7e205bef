package com.walletledger.storage;

import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;

import java.util.List;
import java.util.Optional;

/**
 * Storage port implemented by the JSON file store and the SQLite store.
 *
 * Every load re-validates transfer integrity and fails with an
 * {@link com.walletledger.common.exception.IntegrityException} instead of returning
 * inconsistent data. Bulk replacements are all-or-nothing.
 */
public interface LedgerRepository extends AutoCloseable {

    // Wallets

    List<Wallet> loadWallets();

    List<Wallet> loadActiveWallets();

    /**
     * Create a wallet with the next free id.
     */
    Wallet createWallet(String name, String currency, double initialBalance, boolean allowNegative);

    /**
     * Insert or update a wallet by id.
     */
    void saveWallet(Wallet wallet);

    /**
     * The wallet flagged as system, or wallet 1, or a default wallet if the store has none.
     */
    Wallet getSystemWallet();

    /**
     * Set the initial balance of the system wallet, creating it when missing.
     */
    void saveInitialBalance(double balance);

    double loadInitialBalance();

    // Records

    List<LedgerRecord> loadAll();

    Optional<LedgerRecord> getById(long recordId);

    /**
     * Append a record. A fresh id is assigned when the record has none or its id is taken.
     *
     * @return the record as stored
     */
    LedgerRecord save(LedgerRecord record);

    /**
     * Overwrite the stored record with the same id.
     */
    void replace(LedgerRecord record);

    /**
     * Delete the record at a position of {@link #loadAll()}. Deleting a transfer leg deletes
     * the whole transfer, both legs and its commission.
     */
    void deleteByIndex(int index);

    /**
     * Delete all records together with the transfers they back.
     */
    void deleteAll();

    // Transfers

    List<Transfer> loadTransfers();

    /**
     * Update a transfer whose two legs are already stored.
     */
    void saveTransfer(Transfer transfer);

    /**
     * Delete a transfer with both legs and its commission record.
     *
     * @throws com.walletledger.common.exception.TransferNotFoundException if no such transfer exists
     */
    void deleteTransfer(long transferId);

    // Mandatory expense templates

    List<MandatoryExpenseRecord> loadMandatoryExpenses();

    MandatoryExpenseRecord saveMandatoryExpense(MandatoryExpenseRecord expense);

    void deleteMandatoryExpenseByIndex(int index);

    void deleteAllMandatoryExpenses();

    // Bulk

    /**
     * Atomically replace all records and transfers, keeping wallets and templates.
     */
    void replaceRecordsAndTransfers(List<LedgerRecord> records, List<Transfer> transfers);

    /**
     * Atomically replace the whole dataset.
     */
    void replaceAllData(LedgerDataset dataset);

    /**
     * Full snapshot of the store.
     */
    LedgerDataset loadDataset();

    @Override
    void close();
}
