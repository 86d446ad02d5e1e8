package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobConfig(String name, String callback, List<String> args, List<String> at, Integer everyMinutes) {

    public JobConfig {
        args = args == null ? List.of() : List.copyOf(args);
        at = at == null ? List.of() : List.copyOf(at);
    }

    public static List<JobConfig> defaults() {
        return List.of(
            new JobConfig("publish-feeds", "publish-feeds", List.of(), List.of("06:20", "14:20", "22:20"), null),
            new JobConfig("heartbeat", "heartbeat", List.of(), List.of(), 30)
        );
    }
}
