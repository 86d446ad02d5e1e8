package io.herald.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Start the scheduler and keep running until the process is stopped")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--status-port"}, description = "Serve /healthz and /jobs on this port (overrides config)")
    Integer statusPort;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.daemonRunner().run(statusPort);
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
