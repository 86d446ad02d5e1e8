package io.herald.core.ledger;

/**
 * Persistent set of content keys that were already published.
 *
 * <p>Keys are only ever added. Once {@link #record(String)} returns, {@link #contains(String)} observes
 * the key, also after a restart. A store that cannot be read is reported as a
 * {@link LedgerStorageException}, never treated as empty.
 */
public interface DedupLedger {

    boolean contains(String key) throws LedgerStorageException;

    /**
     * Durably stores the key.
     *
     * @return {@code true} if the key was new, {@code false} if it was already recorded
     */
    boolean record(String key) throws LedgerStorageException;

    int size() throws LedgerStorageException;

    static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("ledger key must not be blank");
        }
        return key.trim();
    }
}
