package com.example.librarysync.domain.enumtype;

public enum AggregateOutcome {
    /** First delivery of the batch for the active run; counters updated. */
    COUNTED,
    /** Fingerprint already in the ledger; nothing changed. */
    DUPLICATE,
    /** The batch belongs to a run that is no longer active. */
    STALE
}
