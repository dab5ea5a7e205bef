package com.walletledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.bootstrap.JsonBackupService;
import com.walletledger.bootstrap.StorageBootstrap;
import com.walletledger.migration.MigrationEngine;
import com.walletledger.storage.LedgerRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the active ledger store. The repository is produced by {@link StorageBootstrap},
 * so a store that fails its startup checks prevents the context from starting.
 */
@Configuration
@EnableConfigurationProperties(LedgerStoreProperties.class)
public class LedgerStoreConfig {

    @Bean
    public JsonBackupService jsonBackupService(ObjectMapper objectMapper) {
        return new JsonBackupService(objectMapper);
    }

    @Bean(destroyMethod = "shutdown")
    public StorageBootstrap storageBootstrap(LedgerStoreProperties properties, MigrationEngine migrationEngine,
                                             JsonBackupService jsonBackupService, ObjectMapper objectMapper) {
        return new StorageBootstrap(properties.getStore(), migrationEngine, jsonBackupService, objectMapper);
    }

    /**
     * Closed by {@link StorageBootstrap#shutdown()} after the final JSON mirror.
     */
    @Bean(destroyMethod = "")
    public LedgerRepository ledgerRepository(StorageBootstrap storageBootstrap) {
        return storageBootstrap.bootstrapRepository();
    }
}
