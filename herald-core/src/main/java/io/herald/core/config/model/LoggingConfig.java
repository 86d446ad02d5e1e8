package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoggingConfig(String dir) {

    public static LoggingConfig defaults() {
        return new LoggingConfig("~/.herald/logs");
    }
}
