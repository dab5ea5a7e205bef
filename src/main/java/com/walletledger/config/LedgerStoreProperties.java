package com.walletledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the {@code ledger} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerStoreProperties {

    @Valid
    @NotNull
    private Store store = new Store();

    @Valid
    @NotNull
    private CurrencySettings currency = new CurrencySettings();

    @Valid
    @NotNull
    private ImportSettings imports = new ImportSettings();

    /**
     * Which store is the active one after startup.
     */
    public enum Backend {
        /**
         * SQLite is active. The JSON file is backed up, migrated once and mirrored on every start.
         */
        SQLITE,

        /**
         * The JSON document is the only store.
         */
        JSON
    }

    @Data
    public static class Store {

        @NotNull
        private Backend backend = Backend.SQLITE;

        @NotBlank
        private String jsonPath = "data.json";

        @NotBlank
        private String sqlitePath = "finance.db";

        /**
         * Schema script on the file system. When unset the bundled {@code db/schema.sql} is used.
         */
        private String schemaPath;

        private boolean backupEnabled = true;

        /**
         * Defaults to a {@code backups} directory next to the JSON file.
         */
        private String backupDir;
    }

    @Data
    public static class CurrencySettings {

        @NotBlank
        private String base = "KZT";

        /**
         * Units of the base currency per one unit of the keyed currency.
         */
        private Map<String, Double> rates = defaultRates();

        private static Map<String, Double> defaultRates() {
            Map<String, Double> rates = new LinkedHashMap<>();
            rates.put("USD", 500.0);
            rates.put("EUR", 590.0);
            rates.put("RUB", 6.5);
            return rates;
        }
    }

    @Data
    public static class ImportSettings {

        @Min(1)
        private int maxRows = 100_000;
    }
}
