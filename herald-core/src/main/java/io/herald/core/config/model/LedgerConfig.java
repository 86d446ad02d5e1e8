package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerConfig(String backend, String path) {

    public static final String FILE = "file";
    public static final String SQLITE = "sqlite";

    public static LedgerConfig defaults() {
        return new LedgerConfig(FILE, "");
    }

    public String backendOrDefault() {
        return backend == null || backend.isBlank() ? FILE : backend.trim().toLowerCase();
    }
}
