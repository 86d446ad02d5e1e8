package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeraldConfig(
    String dataDir,
    SchedulerConfig scheduler,
    LedgerConfig ledger,
    FeedsConfig feeds,
    PublisherConfig publisher,
    NotifierConfig notifier,
    List<JobConfig> jobs,
    LoggingConfig logging,
    StatusConfig status
) {
    public HeraldConfig {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static HeraldConfig defaults() {
        return new HeraldConfig(
            "data",
            SchedulerConfig.defaults(),
            LedgerConfig.defaults(),
            FeedsConfig.defaults(),
            PublisherConfig.defaults(),
            NotifierConfig.defaults(),
            JobConfig.defaults(),
            LoggingConfig.defaults(),
            StatusConfig.defaults()
        );
    }

    public HeraldConfig withPublisher(PublisherConfig publisher) {
        return new HeraldConfig(dataDir, scheduler, ledger, feeds, publisher, notifier, jobs, logging, status);
    }

    public HeraldConfig withNotifier(NotifierConfig notifier) {
        return new HeraldConfig(dataDir, scheduler, ledger, feeds, publisher, notifier, jobs, logging, status);
    }

    public HeraldConfig withLedger(LedgerConfig ledger) {
        return new HeraldConfig(dataDir, scheduler, ledger, feeds, publisher, notifier, jobs, logging, status);
    }
}
