package com.walletledger.common.exception;

import java.util.List;

/**
 * Thrown when a JSON to SQLite migration is refused or rolled back.
 */
public class MigrationException extends LedgerException {

    private final List<String> details;

    public MigrationException(String message) {
        this(message, List.of());
    }

    public MigrationException(String message, List<String> details) {
        super(details.isEmpty() ? message : message + ": " + String.join("; ", details));
        this.details = List.copyOf(details);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
        this.details = List.of();
    }

    public List<String> getDetails() {
        return details;
    }
}
