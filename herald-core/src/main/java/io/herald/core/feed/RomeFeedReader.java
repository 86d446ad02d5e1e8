package io.herald.core.feed;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches RSS or Atom documents over HTTP and maps their entries to {@link FeedItem}s. Entries without a
 * title or link are skipped.
 */
public final class RomeFeedReader implements FeedReader {
    private static final Logger LOG = LoggerFactory.getLogger(RomeFeedReader.class);

    private final OkHttpClient client;

    public RomeFeedReader(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public List<FeedItem> read(String url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml")
            .get()
            .build();

        SyndFeed feed;
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Feed " + url + " returned HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Feed " + url + " returned an empty body");
            }
            try (InputStream in = body.byteStream()) {
                feed = new SyndFeedInput().build(new XmlReader(in));
            } catch (FeedException | IllegalArgumentException e) {
                throw new IOException("Feed " + url + " could not be parsed: " + e.getMessage(), e);
            }
        }

        List<FeedItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            String title = clean(entry.getTitle());
            String link = entry.getLink() == null ? "" : entry.getLink().trim();
            if (title.isBlank() || link.isBlank()) {
                LOG.debug("Skipping entry without title or link in {}", url);
                continue;
            }
            String summary = entry.getDescription() == null ? "" : clean(entry.getDescription().getValue());
            items.add(new FeedItem(FeedKeys.canonical(link), title, link, summary, publishedAt(entry)));
        }
        LOG.debug("Read {} entries from {}", items.size(), url);
        return items;
    }

    private static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text().trim();
    }

    private static Instant publishedAt(SyndEntry entry) {
        Date published = entry.getPublishedDate();
        if (published != null) {
            return published.toInstant();
        }
        Date updated = entry.getUpdatedDate();
        return updated == null ? null : updated.toInstant();
    }
}
