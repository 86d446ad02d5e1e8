package io.herald.core.ledger;

import java.time.Instant;

public record LedgerEntry(String key, Instant recordedAt) {
    public LedgerEntry {
        key = DedupLedger.normalizeKey(key);
        recordedAt = recordedAt == null ? Instant.EPOCH : recordedAt;
    }
}
