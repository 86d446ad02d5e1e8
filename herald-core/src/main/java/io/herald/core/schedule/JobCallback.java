package io.herald.core.schedule;

import java.util.List;

@FunctionalInterface
public interface JobCallback {
    JobOutcome run(List<String> args) throws Exception;
}
