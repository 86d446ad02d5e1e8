package io.herald.core.feed;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads several feeds and merges them newest first. Undated items sort last, and a key seen twice in one
 * pass is kept only once. Individual feed failures are logged and skipped; the pass fails only when
 * every feed failed.
 */
public final class FeedAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(FeedAggregator.class);
    private static final Comparator<FeedItem> NEWEST_FIRST = Comparator.comparing(
        FeedItem::publishedAt,
        Comparator.nullsLast(Comparator.<Instant>reverseOrder())
    );

    private final FeedReader reader;

    public FeedAggregator(FeedReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    public List<FeedItem> collect(List<String> urls) throws IOException {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }

        List<FeedItem> all = new ArrayList<>();
        IOException lastError = null;
        int failures = 0;
        for (String url : urls) {
            try {
                all.addAll(reader.read(url));
            } catch (IOException e) {
                failures++;
                lastError = e;
                LOG.warn("Skipping feed {}: {}", url, e.getMessage());
            }
        }
        if (failures == urls.size()) {
            throw new IOException("All " + failures + " feeds failed, last error: " + lastError.getMessage(), lastError);
        }

        all.sort(NEWEST_FIRST);
        Map<String, FeedItem> unique = new LinkedHashMap<>();
        for (FeedItem item : all) {
            unique.putIfAbsent(item.key(), item);
        }
        return List.copyOf(unique.values());
    }
}
