package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramConfig(
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"bot_token"}) String botToken,
    @JsonAlias({"chat_id"}) String chatId
) {

    public static TelegramConfig defaults() {
        return new TelegramConfig("https://api.telegram.org", "", "");
    }

    public boolean configured() {
        return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }
}
