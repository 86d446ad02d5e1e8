package io.herald.cli;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.JobConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HeraldConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data dir: " + ConfigPaths.resolveDataDir(context.configPath(), config.dataDir()));
            System.out.println("Ledger: " + config.ledger().backendOrDefault() + " at " + ConfigPaths.resolveLedgerPath(context.configPath(), config));
            System.out.println("Feeds: " + config.feeds().urls().size());
            System.out.println("Publisher configured: " + config.publisher().configured());
            System.out.println("Telegram configured: " + config.notifier().telegram().configured());
            System.out.println("Reschedule on failure: " + config.scheduler().rescheduleOnFailure());
            System.out.println("Jobs:");
            for (JobConfig job : config.jobs()) {
                System.out.println("  " + job.name() + " -> " + job.callback() + " " + describeSchedule(job));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describeSchedule(JobConfig job) {
        StringBuilder schedule = new StringBuilder();
        if (!job.at().isEmpty()) {
            schedule.append("at ").append(String.join(", ", job.at()));
        }
        if (job.everyMinutes() != null) {
            if (schedule.length() > 0) {
                schedule.append("; ");
            }
            schedule.append("every ").append(job.everyMinutes()).append(" min");
        }
        return schedule.toString();
    }
}
