package io.herald.core.callback;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.feed.FeedAggregator;
import io.herald.core.feed.FeedItem;
import io.herald.core.feed.FeedReader;
import io.herald.core.ledger.FileDedupLedger;
import io.herald.core.message.MessageComposer;
import io.herald.core.publish.PublicationService;
import io.herald.core.publish.PublishResult;
import io.herald.core.publish.Publisher;
import io.herald.core.schedule.FailureKind;
import io.herald.core.schedule.JobHandle;
import io.herald.core.schedule.JobOutcome;
import io.herald.core.schedule.JobSpec;
import io.herald.core.schedule.Recurrence;
import io.herald.core.schedule.SafeScheduler;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PublishFeedsCallbackTest {

    @TempDir
    Path tempDir;

    private final List<String> posts = new ArrayList<>();
    private final List<String> requestedFeeds = new ArrayList<>();

    @Test
    void shouldUseBoundArgsBeforeConfiguredFeeds() throws Exception {
        PublishFeedsCallback callback = callback(url -> {
            requestedFeeds.add(url);
            return List.of(FeedItem.of("Item from " + url, "https://example.org/" + url, null));
        });

        callback.run(List.of("bound"));
        callback.run(List.of());

        assertThat(requestedFeeds).containsExactly("bound", "configured");
        assertThat(posts).containsExactly(
            "Item from bound https://example.org/bound",
            "Item from configured https://example.org/configured"
        );
    }

    @Test
    void shouldReportFeedFailureAsCallbackFailure() {
        PublishFeedsCallback callback = callback(url -> {
            throw new IOException("connection reset");
        });

        JobOutcome outcome = callback.run(List.of());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.kind()).isEqualTo(FailureKind.CALLBACK);
        assertThat(outcome.message()).contains("connection reset");
    }

    @Test
    void shouldPublishOneNewItemPerScheduledRun() {
        FeedReader reader = url -> List.of(
            FeedItem.of("Newest", "https://example.org/3", Instant.parse("2025-03-01T07:00:00Z")),
            FeedItem.of("Middle", "https://example.org/2", Instant.parse("2025-03-01T06:00:00Z")),
            FeedItem.of("Oldest", "https://example.org/1", Instant.parse("2025-03-01T05:00:00Z"))
        );
        SafeScheduler scheduler = new SafeScheduler(
            Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC),
            ZoneOffset.UTC,
            true,
            text -> {
            }
        );
        JobHandle job = scheduler.register(new JobSpec(
            "publish-feeds@09:00",
            PublishFeedsCallback.NAME,
            callback(reader),
            List.of(),
            Recurrence.dailyAt("09:00")
        ));

        scheduler.runDue(Instant.parse("2025-03-01T09:00:00Z"));
        scheduler.runDue(Instant.parse("2025-03-02T09:00:00Z"));
        scheduler.runDue(Instant.parse("2025-03-03T09:00:00Z"));
        scheduler.runDue(Instant.parse("2025-03-04T09:00:00Z"));

        assertThat(posts).containsExactly(
            "Newest https://example.org/3",
            "Middle https://example.org/2",
            "Oldest https://example.org/1"
        );
        assertThat(job.runs()).isEqualTo(4);
        assertThat(job.failures()).isZero();
    }

    private PublishFeedsCallback callback(FeedReader reader) {
        Publisher publisher = new Publisher() {
            @Override
            public String name() {
                return "recording";
            }

            @Override
            public PublishResult publish(String message) {
                posts.add(message);
                return PublishResult.published(String.valueOf(posts.size()));
            }
        };
        PublicationService publications = new PublicationService(
            new FileDedupLedger(tempDir.resolve("ledger.json")),
            publisher,
            new MessageComposer(List.of(), 250)
        );
        return new PublishFeedsCallback(new FeedAggregator(reader), publications, List.of("configured"), 1);
    }
}
