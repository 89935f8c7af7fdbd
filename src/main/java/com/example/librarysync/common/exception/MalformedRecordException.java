package com.example.librarysync.common.exception;

/**
 * A catalog record lacks a field every track must have, or carries one that cannot be read.
 */
public class MalformedRecordException extends NonRetriableSyncException {

    private final String recordId;
    private final String field;

    public MalformedRecordException(String recordId, String field, String reason) {
        super("Malformed catalog record id=" + recordId + " field=" + field + ": " + reason);
        this.recordId = recordId;
        this.field = field;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getField() {
        return field;
    }
}
