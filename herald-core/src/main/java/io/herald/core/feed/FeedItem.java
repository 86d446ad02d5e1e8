package io.herald.core.feed;

import java.time.Instant;
import java.util.Optional;

/**
 * One entry read from a feed. {@code key} is the canonical link and identifies the item in the dedup
 * ledger; {@code publishedAt} may be null when the feed carries no date.
 */
public record FeedItem(String key, String title, String link, String summary, Instant publishedAt) {

    public FeedItem {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("feed item key must not be blank");
        }
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        summary = summary == null ? "" : summary;
    }

    public static FeedItem of(String title, String link, Instant publishedAt) {
        return new FeedItem(FeedKeys.canonical(link), title, link, "", publishedAt);
    }

    public Optional<Instant> published() {
        return Optional.ofNullable(publishedAt);
    }
}
