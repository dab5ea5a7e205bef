package com.walletledger.common.exception;

/**
 * Thrown when a record is not found.
 */
public class RecordNotFoundException extends DomainException {

    public RecordNotFoundException(String message) {
        super(message);
    }

    public static RecordNotFoundException byId(long recordId) {
        return new RecordNotFoundException("Record not found: " + recordId);
    }

    public static RecordNotFoundException byIndex(int index) {
        return new RecordNotFoundException("No record at index " + index);
    }
}
