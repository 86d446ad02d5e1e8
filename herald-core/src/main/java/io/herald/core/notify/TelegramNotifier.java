package io.herald.core.notify;

import io.herald.core.http.JsonHttpClient;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends operator alerts through the Telegram Bot API {@code sendMessage} method.
 */
public final class TelegramNotifier implements FailureNotifier {
    private static final int MAX_MESSAGE_LENGTH = 4096;

    private final JsonHttpClient http;
    private final String apiBase;
    private final String botToken;
    private final String chatId;

    public TelegramNotifier(JsonHttpClient http, String apiBase, String botToken, String chatId) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.apiBase = trimTrailingSlash(apiBase == null || apiBase.isBlank() ? "https://api.telegram.org" : apiBase);
        this.botToken = Objects.requireNonNull(botToken, "botToken must not be null");
        this.chatId = Objects.requireNonNull(chatId, "chatId must not be null");
    }

    @Override
    public void notify(String text) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) : text);

        Map<String, Object> response = http.postJson(apiBase + "/bot" + botToken + "/sendMessage", Map.of(), body);
        if (!Boolean.TRUE.equals(response.get("ok"))) {
            Object description = response.getOrDefault("description", "request rejected");
            throw new IOException("Telegram sendMessage failed (HTTP " + response.get("http_status") + "): " + description);
        }
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
