package io.herald.core.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerState(int version, List<LedgerEntry> entries) {

    public static final int CURRENT_VERSION = 1;

    public LedgerState {
        version = version <= 0 ? CURRENT_VERSION : version;
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static LedgerState empty() {
        return new LedgerState(CURRENT_VERSION, List.of());
    }
}
