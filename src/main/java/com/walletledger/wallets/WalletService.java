package com.walletledger.wallets;

import com.walletledger.common.Amounts;
import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.exception.DomainException;
import com.walletledger.common.exception.WalletNotFoundException;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Service for managing wallets and reading their derived balances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final LedgerRepository repository;

    public Wallet createWallet(String name, String currency, double initialBalance, boolean allowNegative) {
        Wallet wallet = repository.createWallet(name, CurrencyCodes.normalize(currency), initialBalance, allowNegative);
        log.info("Created wallet {} '{}' in {} with initial balance {}",
            wallet.getId(), wallet.getName(), wallet.getCurrency(), wallet.getInitialBalance());
        return wallet;
    }

    public Wallet getWallet(long walletId) {
        return repository.loadWallets().stream()
            .filter(w -> w.getId() == walletId)
            .findFirst()
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    public List<Wallet> listWallets() {
        return repository.loadWallets();
    }

    public List<Wallet> listActiveWallets() {
        return repository.loadActiveWallets();
    }

    /**
     * Hide a wallet from active listings. Only non-system wallets with a zero balance qualify.
     */
    public Wallet softDeleteWallet(long walletId) {
        LedgerDataset dataset = repository.loadDataset();
        Wallet wallet = dataset.findWallet(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
        if (wallet.isSystem()) {
            throw new DomainException("System wallet cannot be deleted");
        }
        double balance = WalletBalances.balanceOf(wallet, dataset.getRecords());
        if (!Amounts.isZero(balance)) {
            throw new DomainException(String.format(
                "Wallet %d cannot be deleted with a non-zero balance: %.2f", walletId, balance));
        }
        if (!wallet.isActive()) {
            return wallet;
        }
        Wallet deactivated = wallet.deactivate();
        repository.saveWallet(deactivated);
        log.info("Soft-deleted wallet {}", walletId);
        return deactivated;
    }

    public double getBalance(long walletId) {
        LedgerDataset dataset = repository.loadDataset();
        Wallet wallet = dataset.findWallet(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
        return WalletBalances.balanceOf(wallet, dataset.getRecords());
    }

    public Map<Long, Double> getBalances() {
        LedgerDataset dataset = repository.loadDataset();
        return WalletBalances.byWallet(dataset.getWallets(), dataset.getRecords());
    }

    /**
     * Sum of active wallet balances at the rates recorded on each operation.
     */
    public double getNetWorth() {
        LedgerDataset dataset = repository.loadDataset();
        return WalletBalances.netWorth(dataset.getWallets(), dataset.getRecords());
    }
}
