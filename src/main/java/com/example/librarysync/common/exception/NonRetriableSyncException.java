package com.example.librarysync.common.exception;

/**
 * A failure that repeats identically on every redelivery. The task queue dead-letters the task
 * at once instead of spending its retry budget.
 */
public abstract class NonRetriableSyncException extends RuntimeException {

    protected NonRetriableSyncException(String message) {
        super(message);
    }

    protected NonRetriableSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
