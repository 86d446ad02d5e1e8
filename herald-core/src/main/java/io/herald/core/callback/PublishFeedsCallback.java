package io.herald.core.callback;

import io.herald.core.feed.FeedAggregator;
import io.herald.core.feed.FeedItem;
import io.herald.core.publish.PublicationReport;
import io.herald.core.publish.PublicationService;
import io.herald.core.schedule.FailureKind;
import io.herald.core.schedule.JobCallback;
import io.herald.core.schedule.JobOutcome;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the feeds named in the job arguments (or the configured feeds when none are bound) and publishes
 * up to {@code maxPostsPerRun} items that were not published before.
 */
public final class PublishFeedsCallback implements JobCallback {
    public static final String NAME = "publish-feeds";

    private static final Logger LOG = LoggerFactory.getLogger(PublishFeedsCallback.class);

    private final FeedAggregator aggregator;
    private final PublicationService publications;
    private final List<String> defaultUrls;
    private final int maxPostsPerRun;

    public PublishFeedsCallback(
        FeedAggregator aggregator,
        PublicationService publications,
        List<String> defaultUrls,
        int maxPostsPerRun
    ) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.publications = Objects.requireNonNull(publications, "publications must not be null");
        this.defaultUrls = defaultUrls == null ? List.of() : List.copyOf(defaultUrls);
        this.maxPostsPerRun = Math.max(1, maxPostsPerRun);
    }

    @Override
    public JobOutcome run(List<String> args) {
        List<String> urls = args == null || args.isEmpty() ? defaultUrls : args;
        if (urls.isEmpty()) {
            LOG.info("No feeds configured, nothing to publish");
            return JobOutcome.ok();
        }

        List<FeedItem> items;
        try {
            items = aggregator.collect(urls);
        } catch (IOException e) {
            return JobOutcome.failure(FailureKind.CALLBACK, "feed read failed: " + e.getMessage(), e);
        }

        PublicationReport report = publications.publishNew(items, maxPostsPerRun);
        LOG.info(
            "Feed pass over {} feeds: {} items, {} published, {} skipped",
            urls.size(),
            items.size(),
            report.published(),
            report.skipped()
        );
        return report.outcome();
    }
}
