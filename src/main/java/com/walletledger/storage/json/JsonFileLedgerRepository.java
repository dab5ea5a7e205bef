package com.walletledger.storage.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.common.exception.IntegrityException;
import com.walletledger.common.exception.RecordNotFoundException;
import com.walletledger.common.exception.StorageException;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerMutations;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.transfers.Transfer;
import com.walletledger.transfers.TransferIntegrity;
import com.walletledger.wallets.Wallet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ledger store backed by a single JSON document.
 *
 * Every write reads the whole document, applies the change in memory, writes a temp file
 * next to the target and renames it over the target, so readers never see a half-written
 * file. There is no locking: two processes writing the same file overwrite each other.
 */
@Slf4j
public class JsonFileLedgerRepository implements LedgerRepository {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final LedgerDocumentMapper documentMapper;
    private final boolean upgradeInPlace;

    public JsonFileLedgerRepository(Path path) {
        this(path, new ObjectMapper());
    }

    public JsonFileLedgerRepository(Path path, ObjectMapper objectMapper) {
        this(path, objectMapper, true);
    }

    private JsonFileLedgerRepository(Path path, ObjectMapper objectMapper, boolean upgradeInPlace) {
        this.path = path;
        this.upgradeInPlace = upgradeInPlace;
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.documentMapper = new LedgerDocumentMapper(this.objectMapper);
    }

    /**
     * A repository for reading a document as a source, e.g. for migration. Legacy documents
     * are upgraded in memory only and the file is left as it is.
     */
    public static JsonFileLedgerRepository readOnly(Path path, ObjectMapper objectMapper) {
        return new JsonFileLedgerRepository(path, objectMapper, false);
    }

    public Path getPath() {
        return path;
    }

    // Wallets

    @Override
    public List<Wallet> loadWallets() {
        return read().getWallets();
    }

    @Override
    public List<Wallet> loadActiveWallets() {
        return read().getWallets().stream().filter(Wallet::isActive).toList();
    }

    @Override
    public Wallet createWallet(String name, String currency, double initialBalance, boolean allowNegative) {
        LedgerDataset dataset = read();
        Wallet wallet = Wallet.builder()
            .id(LedgerMutations.nextId(dataset.getWallets(), Wallet::getId))
            .name(name)
            .currency(currency)
            .initialBalance(initialBalance)
            .allowNegative(allowNegative)
            .active(true)
            .build();
        List<Wallet> wallets = new ArrayList<>(dataset.getWallets());
        wallets.add(wallet);
        write(dataset.toBuilder().wallets(wallets).build());
        return wallet;
    }

    @Override
    public void saveWallet(Wallet wallet) {
        mutate(dataset -> dataset.toBuilder().wallets(upsertWallet(dataset.getWallets(), wallet)).build());
    }

    @Override
    public Wallet getSystemWallet() {
        return read().systemWallet();
    }

    @Override
    public void saveInitialBalance(double balance) {
        mutate(dataset -> {
            Wallet system = dataset.systemWallet().toBuilder().initialBalance(balance).build();
            return dataset.toBuilder().wallets(upsertWallet(dataset.getWallets(), system)).build();
        });
    }

    @Override
    public double loadInitialBalance() {
        return getSystemWallet().getInitialBalance();
    }

    private static List<Wallet> upsertWallet(List<Wallet> wallets, Wallet wallet) {
        List<Wallet> updated = new ArrayList<>(wallets);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId() == wallet.getId()) {
                updated.set(i, wallet);
                return updated;
            }
        }
        updated.add(wallet);
        return updated;
    }

    // Records

    @Override
    public List<LedgerRecord> loadAll() {
        return read().getRecords();
    }

    @Override
    public Optional<LedgerRecord> getById(long recordId) {
        return read().getRecords().stream().filter(r -> r.getId() == recordId).findFirst();
    }

    @Override
    public LedgerRecord save(LedgerRecord record) {
        LedgerDataset dataset = read();
        LedgerRecord stored = LedgerMutations.assignId(record, dataset.getRecords());
        List<LedgerRecord> records = new ArrayList<>(dataset.getRecords());
        records.add(stored);
        write(dataset.toBuilder().records(records).build());
        return stored;
    }

    @Override
    public void replace(LedgerRecord record) {
        if (record.getId() <= 0) {
            throw new ValidationException("Record id must be positive");
        }
        mutate(dataset -> {
            List<LedgerRecord> records = new ArrayList<>(dataset.getRecords());
            for (int i = 0; i < records.size(); i++) {
                if (records.get(i).getId() == record.getId()) {
                    records.set(i, record);
                    return dataset.toBuilder().records(records).build();
                }
            }
            throw RecordNotFoundException.byId(record.getId());
        });
    }

    @Override
    public void deleteByIndex(int index) {
        mutate(dataset -> {
            List<LedgerRecord> records = dataset.getRecords();
            if (index < 0 || index >= records.size()) {
                throw RecordNotFoundException.byIndex(index);
            }
            LedgerRecord target = records.get(index);
            if (target.getTransferId() != null) {
                return LedgerMutations.removeTransfer(dataset, target.getTransferId());
            }
            List<LedgerRecord> remaining = new ArrayList<>(records);
            remaining.remove(index);
            return dataset.toBuilder().records(remaining).build();
        });
    }

    @Override
    public void deleteAll() {
        mutate(dataset -> dataset.toBuilder().records(List.of()).transfers(List.of()).build());
    }

    // Transfers

    @Override
    public List<Transfer> loadTransfers() {
        return read().getTransfers();
    }

    @Override
    public void saveTransfer(Transfer transfer) {
        mutate(dataset -> {
            List<Transfer> transfers = new ArrayList<>(dataset.getTransfers());
            transfers.removeIf(t -> t.getId() == transfer.getId());
            transfers.add(transfer);
            return dataset.toBuilder().transfers(transfers).build();
        });
    }

    @Override
    public void deleteTransfer(long transferId) {
        mutate(dataset -> LedgerMutations.removeTransfer(dataset, transferId));
        log.info("Deleted transfer #{} from {}", transferId, path);
    }

    // Mandatory expense templates

    @Override
    public List<MandatoryExpenseRecord> loadMandatoryExpenses() {
        return read().getMandatoryExpenses();
    }

    @Override
    public MandatoryExpenseRecord saveMandatoryExpense(MandatoryExpenseRecord expense) {
        LedgerDataset dataset = read();
        MandatoryExpenseRecord stored =
            (MandatoryExpenseRecord) LedgerMutations.assignId(expense, dataset.getMandatoryExpenses());
        List<MandatoryExpenseRecord> templates = new ArrayList<>(dataset.getMandatoryExpenses());
        templates.add(stored);
        write(dataset.toBuilder().mandatoryExpenses(templates).build());
        return stored;
    }

    @Override
    public void deleteMandatoryExpenseByIndex(int index) {
        mutate(dataset -> {
            List<MandatoryExpenseRecord> templates = new ArrayList<>(dataset.getMandatoryExpenses());
            if (index < 0 || index >= templates.size()) {
                throw RecordNotFoundException.byIndex(index);
            }
            templates.remove(index);
            return dataset.toBuilder().mandatoryExpenses(templates).build();
        });
    }

    @Override
    public void deleteAllMandatoryExpenses() {
        mutate(dataset -> dataset.toBuilder().mandatoryExpenses(List.of()).build());
    }

    // Bulk

    @Override
    public void replaceRecordsAndTransfers(List<LedgerRecord> records, List<Transfer> transfers) {
        mutate(dataset -> dataset.toBuilder()
            .records(List.copyOf(records))
            .transfers(List.copyOf(transfers))
            .build());
    }

    @Override
    public void replaceAllData(LedgerDataset dataset) {
        LedgerDataset target = dataset;
        if (target.getWallets().isEmpty()) {
            target = target.toBuilder().wallets(List.of(Wallet.systemDefault(0.0))).build();
        }
        write(target);
        log.info("Replaced ledger document {}: {} wallets, {} records, {} transfers, {} templates",
            path, target.getWallets().size(), target.getRecords().size(),
            target.getTransfers().size(), target.getMandatoryExpenses().size());
    }

    @Override
    public LedgerDataset loadDataset() {
        return read();
    }

    @Override
    public void close() {
        // nothing is held open between calls
    }

    private void mutate(UnaryOperator<LedgerDataset> change) {
        write(change.apply(read()));
    }

    private LedgerDataset read() {
        LedgerDocumentMapper.ReadResult result;
        try {
            JsonNode root = Files.exists(path) ? objectMapper.readTree(path.toFile()) : null;
            result = documentMapper.read(root);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupted ledger document " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StorageException("Cannot read ledger document " + path, e);
        } catch (ValidationException e) {
            throw new StorageException("Corrupted ledger document " + path + ": " + e.getMessage(), e);
        }

        LedgerDataset dataset = result.getDataset();
        TransferIntegrity.validate(dataset.getRecords(), dataset.getTransfers());
        if (result.isUpgraded() && upgradeInPlace && Files.exists(path)) {
            log.info("Upgrading legacy ledger document {}", path);
            write(dataset);
        }
        return dataset;
    }

    private void write(LedgerDataset dataset) {
        try {
            TransferIntegrity.validate(dataset.getRecords(), dataset.getTransfers());
        } catch (IntegrityException e) {
            log.error("Refusing to write {}: {}", path, e.getMessage());
            throw e;
        }

        Path directory = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(temp.toFile(), documentMapper.toDocument(dataset));
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing", directory);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Cannot write ledger document " + path, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Cannot remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
