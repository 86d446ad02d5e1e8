package io.herald.core.config;

import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.LedgerConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("HERALD_CONFIG");
        if (override != null && !override.isBlank()) {
            return expand(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".herald", "config.json");
    }

    /**
     * Resolves the data directory. Relative paths are taken relative to the directory holding the config
     * file, so the default {@code data} lands next to {@code config.json}.
     */
    public static Path resolveDataDir(Path configPath, String rawPath) {
        Path configDir = configPath.toAbsolutePath().getParent();
        if (rawPath == null || rawPath.isBlank()) {
            return configDir.resolve("data");
        }
        Path path = expand(rawPath);
        return path.isAbsolute() ? path : configDir.resolve(path);
    }

    public static Path resolveLogDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".herald", "logs");
        }
        return expand(rawPath);
    }

    public static Path resolveLedgerPath(Path configPath, HeraldConfig config) {
        Path dataDir = resolveDataDir(configPath, config.dataDir());
        LedgerConfig ledger = config.ledger();
        String raw = ledger.path();
        if (raw == null || raw.isBlank()) {
            return dataDir.resolve(LedgerConfig.SQLITE.equals(ledger.backendOrDefault()) ? "ledger.db" : "ledger.json");
        }
        Path path = expand(raw);
        return path.isAbsolute() ? path : dataDir.resolve(path);
    }

    private static Path expand(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
