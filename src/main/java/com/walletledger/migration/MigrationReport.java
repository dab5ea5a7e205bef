package com.walletledger.migration;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class MigrationReport {
    MigrationOutcome outcome;

    /**
     * Rows per table in the JSON source.
     */
    Map<String, Integer> sourceCounts;

    /**
     * Rows written per table, empty unless {@link MigrationOutcome#MIGRATED}.
     */
    Map<String, Integer> insertedCounts;

    /**
     * Whether the ids of each table were kept or newly assigned.
     */
    Map<String, Boolean> idsPreserved;
}
