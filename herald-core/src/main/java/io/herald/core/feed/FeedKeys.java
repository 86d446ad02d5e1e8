package io.herald.core.feed;

import java.util.Locale;
import okhttp3.HttpUrl;

/**
 * Canonical form of an item link, used as its ledger key. Tracking parameters and fragments are
 * dropped so the same article shared through different campaigns maps to one key.
 */
public final class FeedKeys {
    private static final String TRACKING_PREFIX = "utm_";

    private FeedKeys() {
    }

    public static String canonical(String link) {
        if (link == null || link.isBlank()) {
            throw new IllegalArgumentException("link must not be blank");
        }
        String trimmed = link.trim();
        HttpUrl url = HttpUrl.parse(trimmed);
        if (url == null) {
            int hash = trimmed.indexOf('#');
            return hash >= 0 ? trimmed.substring(0, hash) : trimmed;
        }

        HttpUrl.Builder builder = url.newBuilder().fragment(null).query(null);
        for (int i = 0; i < url.querySize(); i++) {
            String name = url.queryParameterName(i);
            if (!name.toLowerCase(Locale.ROOT).startsWith(TRACKING_PREFIX)) {
                builder.addQueryParameter(name, url.queryParameterValue(i));
            }
        }
        return builder.build().toString();
    }
}
