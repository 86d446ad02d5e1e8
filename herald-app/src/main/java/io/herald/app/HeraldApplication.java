package io.herald.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald.cli.CliContext;
import io.herald.cli.HeraldCliCommand;
import io.herald.core.api.StatusServer;
import io.herald.core.callback.HeartbeatCallback;
import io.herald.core.callback.PublishFeedsCallback;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.PublisherConfig;
import io.herald.core.config.model.TelegramConfig;
import io.herald.core.feed.FeedAggregator;
import io.herald.core.feed.RomeFeedReader;
import io.herald.core.http.JsonHttpClient;
import io.herald.core.ledger.DedupLedger;
import io.herald.core.ledger.DedupLedgers;
import io.herald.core.message.MessageComposer;
import io.herald.core.notify.FailureNotifier;
import io.herald.core.notify.LoggingNotifier;
import io.herald.core.notify.TelegramNotifier;
import io.herald.core.publish.DryRunPublisher;
import io.herald.core.publish.HttpPublisher;
import io.herald.core.publish.PublicationService;
import io.herald.core.publish.Publisher;
import io.herald.core.schedule.CallbackRegistry;
import io.herald.core.schedule.JobPlanner;
import io.herald.core.schedule.JobSpec;
import io.herald.core.schedule.RunLoop;
import io.herald.core.schedule.SafeScheduler;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class HeraldApplication {
    static final String LOG_DIR_PROPERTY = "herald.log.dir";

    private HeraldApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        HeraldConfig config = loadConfig(configService, configPath);

        // Must happen before the first logger is created so logback.xml picks it up.
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, ConfigPaths.resolveLogDir(config.logging().dir()).toString());
        }

        CliContext context = new CliContext(
            configService,
            configPath,
            statusPort -> runDaemon(configService, configPath, statusPort)
        );

        int exitCode = HeraldCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static HeraldConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            System.err.println("Could not read " + configPath + ", using defaults for startup: " + e.getMessage());
            return HeraldConfig.defaults();
        }
    }

    private static int runDaemon(ConfigService configService, Path configPath, Integer statusPortOverride) throws Exception {
        Logger log = LoggerFactory.getLogger(HeraldApplication.class);
        HeraldConfig config = configService.load(configPath);
        Clock clock = Clock.systemUTC();

        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(15))
            .readTimeout(Duration.ofSeconds(30))
            .build();
        JsonHttpClient http = new JsonHttpClient(httpClient, new ObjectMapper());

        DedupLedger ledger = DedupLedgers.open(configPath, config);
        PublicationService publications = new PublicationService(
            ledger,
            buildPublisher(config.publisher(), http),
            new MessageComposer(config.feeds().hashtags(), config.feeds().maxTitleLength())
        );

        CallbackRegistry callbacks = new CallbackRegistry();
        callbacks.register(PublishFeedsCallback.NAME, new PublishFeedsCallback(
            new FeedAggregator(new RomeFeedReader(httpClient)),
            publications,
            config.feeds().urls(),
            config.feeds().maxPostsPerRun()
        ));
        callbacks.register(HeartbeatCallback.NAME, new HeartbeatCallback(clock));

        SafeScheduler scheduler = new SafeScheduler(
            clock,
            config.scheduler().zoneId(),
            config.scheduler().rescheduleOnFailure(),
            buildNotifier(config.notifier().telegram(), http)
        );
        for (JobSpec spec : new JobPlanner(callbacks).plan(config.jobs())) {
            scheduler.register(spec);
        }

        Integer statusPort = statusPortOverride != null
            ? statusPortOverride
            : config.status().enabled() ? Integer.valueOf(config.status().port()) : null;
        StatusServer statusServer = statusPort == null
            ? null
            : new StatusServer(config.status().host(), statusPort, scheduler::snapshot);

        CountDownLatch shutdown = new CountDownLatch(1);
        try (RunLoop runLoop = new RunLoop(scheduler, clock, config.scheduler().pollInterval())) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "herald-shutdown"));
            if (statusServer != null) {
                statusServer.start();
                System.out.println("Status endpoint on http://" + config.status().host() + ":" + statusServer.port() + " (GET /healthz, GET /jobs)");
            }
            runLoop.start();
            log.info("Herald running with {} jobs, ledger {}", scheduler.jobs().size(), config.ledger().backendOrDefault());
            scheduler.nextRunAt().ifPresent(next -> System.out.println("Next run at " + next));
            shutdown.await();
        } finally {
            if (statusServer != null) {
                statusServer.close();
            }
            httpClient.dispatcher().executorService().shutdown();
        }
        return 0;
    }

    private static Publisher buildPublisher(PublisherConfig config, JsonHttpClient http) {
        if (!config.configured()) {
            LoggerFactory.getLogger(HeraldApplication.class).warn("No publisher token configured, running in dry-run mode");
            return new DryRunPublisher();
        }
        return new HttpPublisher(http, config.endpoint(), config.accessToken());
    }

    private static FailureNotifier buildNotifier(TelegramConfig config, JsonHttpClient http) {
        if (!config.configured()) {
            return new LoggingNotifier();
        }
        return new TelegramNotifier(http, config.apiBase(), config.botToken(), config.chatId());
    }
}
