package com.walletledger.wallets;

import com.walletledger.records.LedgerRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives wallet balances from records. Balances are never stored.
 */
public final class WalletBalances {

    private WalletBalances() {
    }

    public static double balanceOf(Wallet wallet, Collection<? extends LedgerRecord> records) {
        double balance = wallet.getInitialBalance();
        for (LedgerRecord record : records) {
            if (record.getWalletId() == wallet.getId()) {
                balance += record.signedAmountKzt();
            }
        }
        return balance;
    }

    /**
     * Balance of every wallet keyed by id, in wallet order.
     */
    public static Map<Long, Double> byWallet(Collection<Wallet> wallets, Collection<? extends LedgerRecord> records) {
        Map<Long, Double> balances = new LinkedHashMap<>();
        for (Wallet wallet : wallets) {
            balances.put(wallet.getId(), wallet.getInitialBalance());
        }
        for (LedgerRecord record : records) {
            balances.computeIfPresent(record.getWalletId(), (id, balance) -> balance + record.signedAmountKzt());
        }
        return balances;
    }

    /**
     * Sum of the balances of the active wallets.
     */
    public static double netWorth(Collection<Wallet> wallets, Collection<? extends LedgerRecord> records) {
        Map<Long, Double> balances = byWallet(wallets, records);
        double total = 0.0;
        for (Wallet wallet : wallets) {
            if (wallet.isActive()) {
                total += balances.get(wallet.getId());
            }
        }
        return total;
    }

    /**
     * Sum of the balances of all wallets, soft-deleted ones included.
     */
    public static double totalBalance(Collection<Wallet> wallets, Collection<? extends LedgerRecord> records) {
        return byWallet(wallets, records).values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
