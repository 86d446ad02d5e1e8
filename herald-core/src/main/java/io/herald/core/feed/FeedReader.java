package io.herald.core.feed;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface FeedReader {

    List<FeedItem> read(String url) throws IOException;
}
