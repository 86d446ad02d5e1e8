package io.herald.cli;

import io.herald.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    DaemonRunner daemonRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, statusPort -> {
            throw new UnsupportedOperationException("daemon runner is not configured");
        });
    }
}
