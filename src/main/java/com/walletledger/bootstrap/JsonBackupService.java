package com.walletledger.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.common.exception.StorageException;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.storage.json.JsonFileLedgerRepository;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamped copies of the JSON document and mirroring of the active store back to JSON.
 */
@Slf4j
public class JsonBackupService {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonBackupService(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    public JsonBackupService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Copy {@code jsonPath} to {@code <backupDir>/<stem>_backup_<yyyyMMdd_HHmmss>.json}.
     *
     * @param backupDir target directory, or {@code null} for a {@code backups} directory next to the file
     * @return the written backup
     */
    public Path createBackup(Path jsonPath, Path backupDir) {
        Path directory = backupDir != null ? backupDir : siblingBackups(jsonPath);
        String fileName = jsonPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path backup = directory.resolve(stem + "_backup_" + LocalDateTime.now(clock).format(STAMP) + ".json");
        try {
            Files.createDirectories(directory);
            Files.copy(jsonPath, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Cannot back up " + jsonPath + " to " + backup, e);
        }
        log.info("Backed up {} to {}", jsonPath, backup);
        return backup;
    }

    /**
     * Overwrite the JSON document with the full content of {@code repository}.
     */
    public void exportToJson(LedgerRepository repository, Path jsonPath) {
        new JsonFileLedgerRepository(jsonPath, objectMapper).replaceAllData(repository.loadDataset());
        log.debug("Mirrored active store to {}", jsonPath);
    }

    private static Path siblingBackups(Path jsonPath) {
        Path parent = jsonPath.toAbsolutePath().getParent();
        return parent == null ? Path.of("backups") : parent.resolve("backups");
    }
}
