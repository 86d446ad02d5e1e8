package io.herald.core.publish;

import io.herald.core.schedule.JobOutcome;
import java.util.List;

public record PublicationReport(List<String> publishedKeys, int skipped, JobOutcome outcome) {

    public PublicationReport {
        publishedKeys = publishedKeys == null ? List.of() : List.copyOf(publishedKeys);
    }

    public int published() {
        return publishedKeys.size();
    }
}
