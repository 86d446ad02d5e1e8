package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusConfig(boolean enabled, String host, int port) {

    public static StatusConfig defaults() {
        return new StatusConfig(false, "127.0.0.1", 8797);
    }
}
