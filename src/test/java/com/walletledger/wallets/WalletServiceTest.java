package com.walletledger.wallets;

import com.walletledger.common.exception.DomainException;
import com.walletledger.common.exception.WalletNotFoundException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WalletService.
 *
 * The repository is mocked so only wallet rules are exercised:
 * - the system wallet is never deleted
 * - only zero-balance wallets can be soft-deleted
 * - net worth ignores inactive wallets
 */
@ExtendWith(MockitoExtension.class)
class WalletServiceTest {

    @Mock
    private LedgerRepository repository;

    @InjectMocks
    private WalletService walletService;

    private static Wallet wallet(long id, double initialBalance, boolean active) {
        return Wallet.builder()
            .id(id)
            .name("Wallet " + id)
            .currency("KZT")
            .initialBalance(initialBalance)
            .active(active)
            .build();
    }

    private static LedgerRecord expense(long walletId, double amount) {
        return LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .id(1)
            .date(LocalDate.of(2025, 2, 1))
            .walletId(walletId)
            .amountOriginal(amount)
            .currency("KZT")
            .amountKzt(amount)
            .build();
    }

    @Test
    void testSoftDeleteZeroBalanceWallet() {
        LedgerDataset dataset = LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(0), wallet(2, 40, true)))
            .records(List.of(expense(2, 40)))
            .build();
        when(repository.loadDataset()).thenReturn(dataset);

        Wallet result = walletService.softDeleteWallet(2);

        assertFalse(result.isActive());
        ArgumentCaptor<Wallet> saved = ArgumentCaptor.forClass(Wallet.class);
        verify(repository).saveWallet(saved.capture());
        assertEquals(2, saved.getValue().getId());
        assertFalse(saved.getValue().isActive());
    }

    @Test
    void testSoftDeleteRejectsSystemWallet() {
        when(repository.loadDataset()).thenReturn(LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(0)))
            .build());

        DomainException e = assertThrows(DomainException.class, () -> walletService.softDeleteWallet(1));
        assertEquals("System wallet cannot be deleted", e.getMessage());
        verify(repository, never()).saveWallet(any());
    }

    @Test
    void testSoftDeleteRejectsNonZeroBalance() {
        when(repository.loadDataset()).thenReturn(LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(0), wallet(2, 100, true)))
            .records(List.of(expense(2, 40)))
            .build());

        assertThrows(DomainException.class, () -> walletService.softDeleteWallet(2));
        verify(repository, never()).saveWallet(any());
    }

    @Test
    void testSoftDeleteIsIdempotent() {
        when(repository.loadDataset()).thenReturn(LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(0), wallet(2, 0, false)))
            .build());

        Wallet result = walletService.softDeleteWallet(2);

        assertFalse(result.isActive());
        verify(repository, never()).saveWallet(any());
    }

    @Test
    void testUnknownWallet() {
        when(repository.loadDataset()).thenReturn(LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(0)))
            .build());

        assertThrows(WalletNotFoundException.class, () -> walletService.softDeleteWallet(9));
        assertThrows(WalletNotFoundException.class, () -> walletService.getBalance(9));
    }

    @Test
    void testNetWorthSkipsInactiveWallets() {
        when(repository.loadDataset()).thenReturn(LedgerDataset.builder()
            .wallets(List.of(Wallet.systemDefault(1000), wallet(2, 250, true), wallet(3, 70, false)))
            .records(List.of(expense(1, 100)))
            .build());

        assertEquals(1150.0, walletService.getNetWorth(), 1e-9);
        assertEquals(900.0, walletService.getBalances().get(1L), 1e-9);
    }
}
