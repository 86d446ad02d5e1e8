package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedsConfig(List<String> urls, List<String> hashtags, int maxTitleLength, int maxPostsPerRun) {

    public FeedsConfig {
        urls = urls == null ? List.of() : List.copyOf(urls);
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    public static FeedsConfig defaults() {
        return new FeedsConfig(
            List.of(),
            List.of(
                "psilocybin",
                "psychedelic",
                "microdosing",
                "drug policy",
                "harm reduction",
                "ketamine",
                "mdma",
                "psychotherapy"
            ),
            250,
            1
        );
    }
}
