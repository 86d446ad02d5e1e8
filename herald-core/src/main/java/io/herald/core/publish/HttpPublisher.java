package io.herald.core.publish;

import io.herald.core.http.JsonHttpClient;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

public final class HttpPublisher implements Publisher {
    private final JsonHttpClient http;
    private final String endpoint;
    private final String accessToken;

    public HttpPublisher(JsonHttpClient http, String endpoint, String accessToken) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.accessToken = accessToken == null ? "" : accessToken;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public PublishResult publish(String message) {
        Map<String, Object> response;
        try {
            response = http.postJson(endpoint, Map.of("Authorization", "Bearer " + accessToken), Map.of("text", message));
        } catch (IOException e) {
            return PublishResult.failed(PublishError.transport(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }

        int status = response.get("http_status") instanceof Number n ? n.intValue() : 0;
        if (!Boolean.TRUE.equals(response.get("ok"))) {
            return PublishResult.failed(new PublishError(status, errorDetail(response)));
        }
        return PublishResult.published(extractId(response));
    }

    private static String extractId(Map<String, Object> response) {
        if (response.get("data") instanceof Map<?, ?> data && data.get("id") != null) {
            return String.valueOf(data.get("id"));
        }
        Object id = response.get("id");
        return id == null ? "" : String.valueOf(id);
    }

    private static String errorDetail(Map<String, Object> response) {
        for (String key : new String[] {"detail", "error", "title", "raw"}) {
            Object value = response.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return "request rejected";
    }
}
