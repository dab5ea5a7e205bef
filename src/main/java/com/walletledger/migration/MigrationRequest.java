package com.walletledger.migration;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Source, target and schema of a JSON to SQLite migration.
 */
@Value
@Builder
public class MigrationRequest {
    Path jsonPath;
    Path sqlitePath;

    /**
     * Schema script; the bundled one is used when {@code null}.
     */
    Path schemaPath;
}
