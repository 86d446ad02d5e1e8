package io.herald.cli;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.OnboardResult;
import io.herald.core.config.model.HeraldConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "onboard",
    description = "Write config.json with the default feeds and jobs, create the data directory for the dedup ledger"
)
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Reset config to defaults: " + result.configPath());
            } else {
                System.out.println("Kept config, added missing defaults: " + result.configPath());
            }
            System.out.println("Data dir ready: " + result.dataDir());

            HeraldConfig config = context.configService().load(context.configPath());
            System.out.println("Ledger: " + config.ledger().backendOrDefault() + " at "
                + ConfigPaths.resolveLedgerPath(context.configPath(), config));
            System.out.println("Jobs: " + config.jobs().size() + ", feeds: " + config.feeds().urls().size());
            if (!config.publisher().configured()) {
                System.out.println("No publisher token: posts are dry runs until HERALD_PUBLISHER_TOKEN is set");
            }
            if (!config.notifier().telegram().configured()) {
                System.out.println("No Telegram bot: job failures are only logged");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
