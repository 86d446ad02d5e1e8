package io.herald.core.schedule;

import java.util.List;

public record RunReport(int executed, List<String> failedJobs) {
    public RunReport {
        failedJobs = failedJobs == null ? List.of() : List.copyOf(failedJobs);
    }

    public int failed() {
        return failedJobs.size();
    }

    public int succeeded() {
        return executed - failedJobs.size();
    }
}
