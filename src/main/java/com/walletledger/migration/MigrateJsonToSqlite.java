package com.walletledger.migration;

import com.walletledger.common.exception.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.SimpleCommandLinePropertySource;

import java.nio.file.Path;

/**
 * Command line entry point for the JSON to SQLite migration.
 *
 * <pre>
 * --json-path=data.json --sqlite-path=finance.db [--schema-path=schema.sql] [--dry-run]
 * </pre>
 */
@Slf4j
public final class MigrateJsonToSqlite {

    private MigrateJsonToSqlite() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return process exit code, 0 on success
     */
    static int run(String[] args) {
        SimpleCommandLinePropertySource options = new SimpleCommandLinePropertySource(args);
        String schemaPath = options.getProperty("schema-path");
        MigrationRequest request = MigrationRequest.builder()
            .jsonPath(Path.of(option(options, "json-path", "data.json")))
            .sqlitePath(Path.of(option(options, "sqlite-path", "finance.db")))
            .schemaPath(schemaPath == null ? null : Path.of(schemaPath))
            .build();

        MigrationEngine engine = new MigrationEngine();
        try {
            MigrationReport report = options.containsProperty("dry-run")
                ? engine.dryRun(request)
                : engine.migrate(request);
            log.info("Migration finished: {} {}", report.getOutcome(), report.getSourceCounts());
            return 0;
        } catch (MigrationException e) {
            log.error("Migration failed: {}", e.getMessage());
            return 1;
        }
    }

    private static String option(SimpleCommandLinePropertySource options, String name, String defaultValue) {
        String value = options.getProperty(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
