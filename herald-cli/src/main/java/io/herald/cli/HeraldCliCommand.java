package io.herald.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "herald", mixinStandardHelpOptions = true, description = "Recurring feed publisher with a fault-tolerant scheduler")
public final class HeraldCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new HeraldCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("ledger", new CommandLine(new LedgerCommand())
            .addSubcommand("size", new LedgerCommand.Size(context))
            .addSubcommand("contains", new LedgerCommand.Contains(context)));
        return commandLine;
    }
}
