package com.walletledger.migration;

/**
 * How a migration run ended when it did not fail.
 */
public enum MigrationOutcome {
    /**
     * Source and target were checked, nothing was written.
     */
    DRY_RUN_OK,

    /**
     * The source was copied into an empty target and verified.
     */
    MIGRATED,

    /**
     * The target already holds data equivalent to the source. Nothing was written.
     */
    ALREADY_MIGRATED
}
