package io.herald.core.publish;

import io.herald.core.feed.FeedItem;
import io.herald.core.ledger.DedupLedger;
import io.herald.core.ledger.LedgerStorageException;
import io.herald.core.message.MessageComposer;
import io.herald.core.schedule.FailureKind;
import io.herald.core.schedule.JobOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes feed items that are not yet in the dedup ledger.
 *
 * <p>A key is recorded only after the publisher confirmed the post, so a crash between publish and
 * record can at worst publish the item once more. A publish failure or a ledger error ends the pass and
 * is returned as a failed {@link JobOutcome}.
 */
public final class PublicationService {
    private static final Logger LOG = LoggerFactory.getLogger(PublicationService.class);

    private final DedupLedger ledger;
    private final Publisher publisher;
    private final MessageComposer composer;

    public PublicationService(DedupLedger ledger, Publisher publisher, MessageComposer composer) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
    }

    public PublicationReport publishNew(List<FeedItem> items, int limit) {
        int max = Math.max(1, limit);
        List<String> published = new ArrayList<>();
        int skipped = 0;

        for (FeedItem item : items) {
            if (published.size() >= max) {
                break;
            }
            try {
                if (ledger.contains(item.key())) {
                    skipped++;
                    continue;
                }
            } catch (LedgerStorageException e) {
                return new PublicationReport(published, skipped, storageFailure(item, e));
            }

            String message = composer.compose(item);
            PublishResult result = publisher.publish(message);
            if (!result.ok()) {
                String detail = result.failure().map(PublishError::describe).orElse("unknown error");
                return new PublicationReport(
                    published,
                    skipped,
                    JobOutcome.failure(FailureKind.PUBLISH, "publish of " + item.key() + " failed: " + detail)
                );
            }

            try {
                ledger.record(item.key());
            } catch (LedgerStorageException e) {
                LOG.warn("Published {} as {} but could not record it", item.key(), result.id());
                published.add(item.key());
                return new PublicationReport(published, skipped, storageFailure(item, e));
            }
            published.add(item.key());
            LOG.info("Published {} via {} (id {})", item.key(), publisher.name(), result.id());
        }

        if (published.isEmpty()) {
            LOG.info("Nothing new to publish ({} already published)", skipped);
        }
        return new PublicationReport(published, skipped, JobOutcome.ok());
    }

    private static JobOutcome storageFailure(FeedItem item, LedgerStorageException e) {
        return JobOutcome.failure(FailureKind.STORAGE, "ledger error for " + item.key() + ": " + e.getMessage(), e);
    }
}
