package io.herald.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.LedgerConfig;
import io.herald.core.config.model.NotifierConfig;
import io.herald.core.config.model.PublisherConfig;
import io.herald.core.config.model.TelegramConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the JSON config file with defaults merged underneath, then applies secret overrides from the
 * environment. The result is immutable and handed to constructors at startup.
 */
public final class ConfigService {
    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> env) {
        this.env = env == null ? Map.of() : Map.copyOf(env);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public HeraldConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return applyEnvironment(HeraldConfig.defaults());
        }

        JsonNode defaultsNode = mapper.valueToTree(HeraldConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return applyEnvironment(mapper.treeToValue(merged, HeraldConfig.class));
    }

    public void save(Path configPath, HeraldConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        HeraldConfig config;
        if (created || overwrite) {
            config = HeraldConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = loadFileOnly(configPath);
        }

        save(configPath, config);

        Path dataDir = ConfigPaths.resolveDataDir(configPath, config.dataDir());
        Files.createDirectories(dataDir);
        return new OnboardResult(configPath, dataDir, created, overwritten);
    }

    private HeraldConfig loadFileOnly(Path configPath) throws IOException {
        JsonNode defaultsNode = mapper.valueToTree(HeraldConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), HeraldConfig.class);
    }

    private HeraldConfig applyEnvironment(HeraldConfig config) {
        HeraldConfig result = config;

        String publisherToken = env("HERALD_PUBLISHER_TOKEN");
        if (publisherToken != null) {
            result = result.withPublisher(new PublisherConfig(result.publisher().endpoint(), publisherToken));
        }

        String botToken = env("HERALD_TELEGRAM_BOT_TOKEN");
        String chatId = env("HERALD_TELEGRAM_CHAT_ID");
        if (botToken != null || chatId != null) {
            TelegramConfig telegram = result.notifier().telegram();
            result = result.withNotifier(new NotifierConfig(new TelegramConfig(
                telegram.apiBase(),
                botToken != null ? botToken : telegram.botToken(),
                chatId != null ? chatId : telegram.chatId()
            )));
        }

        String backend = env("HERALD_LEDGER_BACKEND");
        if (backend != null) {
            result = result.withLedger(new LedgerConfig(backend, result.ledger().path()));
        }
        return result;
    }

    private String env(String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
