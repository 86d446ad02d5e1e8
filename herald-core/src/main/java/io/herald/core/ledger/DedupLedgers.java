package io.herald.core.ledger;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.LedgerConfig;
import java.nio.file.Path;

public final class DedupLedgers {

    private DedupLedgers() {
    }

    public static DedupLedger open(Path configPath, HeraldConfig config) throws LedgerStorageException {
        Path path = ConfigPaths.resolveLedgerPath(configPath, config);
        String backend = config.ledger().backendOrDefault();
        return switch (backend) {
            case LedgerConfig.SQLITE -> new SqliteDedupLedger(path);
            case LedgerConfig.FILE -> new FileDedupLedger(path);
            default -> throw new IllegalArgumentException("Unknown ledger backend '" + backend + "', expected file or sqlite");
        };
    }
}
