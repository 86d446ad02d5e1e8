package io.herald.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Thin JSON-over-HTTP helper shared by the publisher and notifier. The returned map always carries
 * {@code http_status} and {@code ok}; a non-JSON body is kept under {@code raw}.
 */
public final class JsonHttpClient {
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public JsonHttpClient(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public Map<String, Object> postJson(String url, Map<String, String> headers, Map<String, Object> body) throws IOException {
        HttpUrl target = HttpUrl.parse(url);
        if (target == null) {
            throw new IOException("Invalid URL: " + url);
        }

        Request.Builder requestBuilder = new Request.Builder()
            .url(target)
            .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
        for (Map.Entry<String, String> header : headers.entrySet()) {
            requestBuilder.addHeader(header.getKey(), header.getValue());
        }

        try (Response response = client.newCall(requestBuilder.build()).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            Map<String, Object> payload = new LinkedHashMap<>(parseJsonBody(raw));
            payload.put("http_status", response.code());
            payload.put("ok", response.isSuccessful());
            return payload;
        }
    }

    private Map<String, Object> parseJsonBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = mapper.readValue(raw, new TypeReference<>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            return Map.of("raw", raw);
        }
    }
}
