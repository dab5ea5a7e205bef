package com.walletledger.common.exception;

import com.walletledger.imports.ImportSummary;

/**
 * Thrown when a batch import is refused as a whole.
 */
public class ImportRejectedException extends ValidationException {

    private final transient ImportSummary summary;

    public ImportRejectedException(String message) {
        this(message, null);
    }

    public ImportRejectedException(String message, ImportSummary summary) {
        super(message);
        this.summary = summary;
    }

    public ImportSummary getSummary() {
        return summary;
    }
}
