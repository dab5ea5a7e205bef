package com.walletledger.transfers;

import com.walletledger.common.exception.BrokenTransferPairException;
import com.walletledger.common.exception.DanglingTransferLinkException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.RecordType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransferIntegrityTest {

    private static final LocalDate DATE = LocalDate.of(2025, 3, 1);

    private static Transfer transfer(long id) {
        return Transfer.builder()
            .id(id)
            .fromWalletId(1)
            .toWalletId(2)
            .date(DATE)
            .amountOriginal(100)
            .currency("KZT")
            .amountKzt(100)
            .build();
    }

    private static LedgerRecord leg(long id, RecordType type, long walletId, Long transferId) {
        return LedgerRecord.builder()
            .type(type)
            .id(id)
            .date(DATE)
            .walletId(walletId)
            .transferId(transferId)
            .amountOriginal(100)
            .currency("KZT")
            .amountKzt(100)
            .category("Transfer")
            .build();
    }

    @Test
    void testValidPairPasses() {
        assertDoesNotThrow(() -> TransferIntegrity.validate(
            List.of(leg(1, RecordType.EXPENSE, 1, 1L), leg(2, RecordType.INCOME, 2, 1L)),
            List.of(transfer(1))));
    }

    @Test
    void testDanglingTransferLink() {
        DanglingTransferLinkException e = assertThrows(DanglingTransferLinkException.class,
            () -> TransferIntegrity.validate(List.of(leg(4, RecordType.EXPENSE, 1, 9L)), List.of()));
        assertTrue(e.getMessage().contains("#4"));
        assertTrue(e.getMessage().contains("#9"));
    }

    @Test
    void testDanglingCommissionLink() {
        LedgerRecord commission = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .id(3)
            .date(DATE)
            .walletId(1)
            .commissionForTransferId(5L)
            .amountOriginal(10)
            .currency("KZT")
            .amountKzt(10)
            .build();
        assertThrows(DanglingTransferLinkException.class,
            () -> TransferIntegrity.validate(List.of(commission), List.of()));
    }

    @Test
    void testTransferWithOneLeg() {
        BrokenTransferPairException e = assertThrows(BrokenTransferPairException.class,
            () -> TransferIntegrity.validate(List.of(leg(1, RecordType.EXPENSE, 1, 1L)), List.of(transfer(1))));
        assertTrue(e.getMessage().contains("1 linked records"));
    }

    @Test
    void testTransferWithTwoExpenses() {
        assertThrows(BrokenTransferPairException.class, () -> TransferIntegrity.validate(
            List.of(leg(1, RecordType.EXPENSE, 1, 1L), leg(2, RecordType.EXPENSE, 2, 1L)),
            List.of(transfer(1))));
    }
}
