package com.walletledger.imports;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch import.
 */
@Value
public class ImportSummary {
    int imported;
    int skipped;
    List<String> errors;

    public ImportSummary(int imported, int skipped, List<String> errors) {
        this.imported = imported;
        this.skipped = skipped;
        this.errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return skipped > 0;
    }
}
