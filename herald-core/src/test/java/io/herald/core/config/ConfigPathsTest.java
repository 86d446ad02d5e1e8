package io.herald.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.LedgerConfig;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ConfigPathsTest {

    private final Path configPath = Path.of("/srv/herald/config.json");

    @Test
    void shouldResolveDataDirNextToConfigFile() {
        assertThat(ConfigPaths.resolveDataDir(configPath, "")).isEqualTo(Path.of("/srv/herald/data"));
        assertThat(ConfigPaths.resolveDataDir(configPath, "state")).isEqualTo(Path.of("/srv/herald/state"));
        assertThat(ConfigPaths.resolveDataDir(configPath, "/var/lib/herald")).isEqualTo(Path.of("/var/lib/herald"));
    }

    @Test
    void shouldExpandHomeDirectory() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.resolveDataDir(configPath, "~/herald-data")).isEqualTo(home.resolve("herald-data"));
        assertThat(ConfigPaths.resolveLogDir("")).isEqualTo(home.resolve(".herald/logs"));
    }

    @Test
    void shouldPickLedgerFileNameFromBackend() {
        HeraldConfig defaults = HeraldConfig.defaults();
        HeraldConfig sqlite = defaults.withLedger(new LedgerConfig(LedgerConfig.SQLITE, ""));

        assertThat(ConfigPaths.resolveLedgerPath(configPath, defaults)).isEqualTo(Path.of("/srv/herald/data/ledger.json"));
        assertThat(ConfigPaths.resolveLedgerPath(configPath, sqlite)).isEqualTo(Path.of("/srv/herald/data/ledger.db"));
    }
}
