package io.herald.core.message;

import io.herald.core.feed.FeedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a feed item into a short post: configured keywords in the title become hashtags, the title is
 * cut to {@code maxTitleLength} characters, and the link is appended.
 */
public final class MessageComposer {
    public static final int DEFAULT_MAX_TITLE_LENGTH = 250;
    private static final String ELLIPSIS = "...";

    private final List<Pattern> keywords;
    private final int maxTitleLength;

    public MessageComposer(List<String> hashtags, int maxTitleLength) {
        this.maxTitleLength = maxTitleLength > 0 ? maxTitleLength : DEFAULT_MAX_TITLE_LENGTH;
        List<Pattern> patterns = new ArrayList<>();
        if (hashtags != null) {
            for (String keyword : hashtags) {
                if (keyword != null && !keyword.isBlank()) {
                    patterns.add(Pattern.compile("(?<!#)\\b" + Pattern.quote(keyword.trim()), Pattern.CASE_INSENSITIVE));
                }
            }
        }
        this.keywords = List.copyOf(patterns);
    }

    public String compose(FeedItem item) {
        String title = shorten(insertHashtags(item.title()), maxTitleLength);
        return item.link().isBlank() ? title : title + " " + item.link();
    }

    public String insertHashtags(String title) {
        String result = title == null ? "" : title;
        for (Pattern keyword : keywords) {
            Matcher matcher = keyword.matcher(result);
            if (matcher.find()) {
                String tag = "#" + matcher.group().replace(" ", "");
                result = result.substring(0, matcher.start()) + tag + result.substring(matcher.end());
            }
        }
        return result;
    }

    public static String shorten(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
    }
}
