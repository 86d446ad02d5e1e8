package io.herald.cli;

import io.herald.core.config.model.HeraldConfig;
import io.herald.core.feed.FeedKeys;
import io.herald.core.ledger.DedupLedger;
import io.herald.core.ledger.DedupLedgers;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "ledger", description = "Inspect the dedup ledger")
public final class LedgerCommand implements Runnable {

    @Override
    public void run() {
        // Shows help when no subcommand is provided.
    }

    private static DedupLedger open(CliContext context) throws Exception {
        HeraldConfig config = context.configService().load(context.configPath());
        return DedupLedgers.open(context.configPath(), config);
    }

    @Command(name = "size", description = "Print the number of published keys")
    public static final class Size implements Callable<Integer> {
        private final CliContext context;

        public Size(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try {
                System.out.println(open(context).size());
                return 0;
            } catch (Exception e) {
                System.err.println("Ledger size failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "contains", description = "Check whether a key was already published (exit code 0 if yes, 2 if not)")
    public static final class Contains implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", description = "Item link; tracking parameters and fragments are ignored")
        String key;

        public Contains(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try {
                boolean present = open(context).contains(FeedKeys.canonical(key));
                System.out.println(present ? "published" : "not published");
                return present ? 0 : 2;
            } catch (Exception e) {
                System.err.println("Ledger lookup failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
