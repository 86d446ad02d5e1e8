package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PublisherConfig(
    String endpoint,
    @JsonAlias({"access_token"}) String accessToken
) {

    public static PublisherConfig defaults() {
        return new PublisherConfig("https://api.twitter.com/2/tweets", "");
    }

    public boolean configured() {
        return accessToken != null && !accessToken.isBlank() && endpoint != null && !endpoint.isBlank();
    }
}
