package io.herald.core.schedule;

public enum FailureKind {
    /** The unit of work itself failed or threw. */
    CALLBACK,
    /** The dedup ledger could not be read or written. */
    STORAGE,
    /** The external publisher rejected or dropped the message. */
    PUBLISH
}
