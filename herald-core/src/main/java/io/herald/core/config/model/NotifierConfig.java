package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotifierConfig(TelegramConfig telegram) {

    public static NotifierConfig defaults() {
        return new NotifierConfig(TelegramConfig.defaults());
    }
}
