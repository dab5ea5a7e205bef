package com.walletledger.storage;

import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of everything a store holds.
 */
@Value
@Builder(toBuilder = true)
public class LedgerDataset {

    @Builder.Default
    List<Wallet> wallets = List.of();

    @Builder.Default
    List<LedgerRecord> records = List.of();

    @Builder.Default
    List<Transfer> transfers = List.of();

    @Builder.Default
    List<MandatoryExpenseRecord> mandatoryExpenses = List.of();

    public static LedgerDataset empty() {
        return LedgerDataset.builder().build();
    }

    public boolean isEmpty() {
        return wallets.isEmpty() && records.isEmpty() && transfers.isEmpty() && mandatoryExpenses.isEmpty();
    }

    public Optional<Wallet> findWallet(long walletId) {
        return wallets.stream().filter(w -> w.getId() == walletId).findFirst();
    }

    /**
     * Same lookup order as the stores: the flagged wallet, then wallet 1, then a default.
     */
    public Wallet systemWallet() {
        return wallets.stream().filter(Wallet::isSystem).findFirst()
            .or(() -> findWallet(Wallet.SYSTEM_WALLET_ID))
            .orElseGet(() -> Wallet.systemDefault(0.0));
    }
}
