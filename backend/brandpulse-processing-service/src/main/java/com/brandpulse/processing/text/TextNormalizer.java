package com.brandpulse.processing.text;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Platform-aware cleaning. The returned display form keeps the author's casing;
 * {@link #matchForm(String)} gives the lower-cased twin used for lexical matching,
 * with identical offsets.
 */
@Component
public class TextNormalizer {

    public static final String REDDIT = "reddit";
    public static final String NEWS = "news";
    public static final String TWITTER = "twitter";

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]{1,200}>");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern USABLE = Pattern.compile("[\\p{L}\\p{N}]");

    // reddit markdown
    private static final Pattern MD_LINK = Pattern.compile("\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern MD_QUOTE = Pattern.compile("(?m)^\\s*>+\\s?");
    private static final Pattern MD_HEADING = Pattern.compile("(?m)^\\s*#{1,6}\\s+");
    private static final Pattern MD_LIST = Pattern.compile("(?m)^\\s*(?:[*+-]|\\d+\\.)\\s+");
    private static final Pattern MD_EMPHASIS = Pattern.compile("\\*{1,3}|_{2,3}|~~|`+|\\^");
    private static final Pattern MD_SPOILER = Pattern.compile(">!|!<");
    private static final Pattern REDDIT_USER = Pattern.compile("(?i)(?<![\\w/])/?u/[A-Za-z0-9_-]+");
    private static final Pattern SUBREDDIT = Pattern.compile("(?i)(?<![\\w/])/?r/([A-Za-z0-9_]+)");
    private static final Pattern EDIT_LINE = Pattern.compile("(?im)^\\s*edit\\s*\\d*\\s*:.*$");

    // news boilerplate
    private static final Pattern BYLINE = Pattern.compile(
        "(?m)^\\s*(?:By|BY)\\s+[A-Z][\\w.'-]*(?:\\s+[A-Z][\\w.'-]*){0,3}"
            + "(?:\\s*(?:,|and|&)\\s*[A-Z][\\w.'-]*(?:\\s+[A-Z][\\w.'-]*){0,3})*\\s*(?:[|:\\u2013\\u2014-].*)?$");
    private static final Pattern DATELINE = Pattern.compile(
        "^\\s*(?:[A-Z][A-Za-z .,'-]{0,40}\\s*)?\\((?:Reuters|AP|AFP|Bloomberg|CNN|BBC)\\)\\s*[\\u2013\\u2014-]+\\s*");
    private static final Pattern NEWS_BOILERPLATE = Pattern.compile(
        "(?im)^\\s*(?:read more|advertisement|subscribe(?: now)?|click here|related|sign up)\\b.*$");

    // twitter
    private static final Pattern RETWEET = Pattern.compile("^\\s*RT\\s+@\\w+:?\\s*");
    private static final Pattern AT_MENTION = Pattern.compile("(?<![\\w@])@\\w{1,30}");
    private static final Pattern HASHTAG = Pattern.compile("(?<![\\w#])#(\\w+)");

    private final int maxLength;

    public TextNormalizer(@Value("${brandpulse.text.max-length:2000}") int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * @return the cleaned display text, or the empty string when nothing usable remains
     */
    public String normalize(String text, String platform) {
        if (text == null || text.isBlank()) return "";

        String out = unescapeEntities(text);
        out = HTML_TAG.matcher(out).replaceAll(" ");

        switch (platformKey(platform)) {
            case REDDIT -> out = cleanReddit(out);
            case NEWS -> out = cleanNews(out);
            case TWITTER -> out = cleanTwitter(out);
            default -> { }
        }

        out = URL.matcher(out).replaceAll(" ");
        out = Normalizer.normalize(out, Normalizer.Form.NFKC);
        out = WHITESPACE.matcher(out).replaceAll(" ").trim();

        if (out.length() > maxLength) {
            out = out.substring(0, maxLength).trim();
        }
        return USABLE.matcher(out).find() ? out : "";
    }

    /** Lower-cased copy with the same length, so offsets carry over unchanged. */
    public static String matchForm(String normalized) {
        if (normalized == null) return "";
        char[] chars = normalized.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    static String platformKey(String platform) {
        return platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
    }

    private String cleanReddit(String text) {
        String out = MD_LINK.matcher(text).replaceAll("$1");
        out = EDIT_LINE.matcher(out).replaceAll(" ");
        out = MD_QUOTE.matcher(out).replaceAll("");
        out = MD_HEADING.matcher(out).replaceAll("");
        out = MD_LIST.matcher(out).replaceAll("");
        out = MD_SPOILER.matcher(out).replaceAll(" ");
        out = MD_EMPHASIS.matcher(out).replaceAll("");
        out = REDDIT_USER.matcher(out).replaceAll(" ");
        return SUBREDDIT.matcher(out).replaceAll("$1");
    }

    private String cleanNews(String text) {
        String out = BYLINE.matcher(text).replaceAll(" ");
        out = NEWS_BOILERPLATE.matcher(out).replaceAll(" ");
        return DATELINE.matcher(out).replaceFirst("");
    }

    private String cleanTwitter(String text) {
        String out = RETWEET.matcher(text).replaceFirst("");
        out = AT_MENTION.matcher(out).replaceAll(" ");
        return HASHTAG.matcher(out).replaceAll("$1");
    }

    private static String unescapeEntities(String text) {
        if (text.indexOf('&') < 0) return text;
        return text.replace("&nbsp;", " ")
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&#39;", "'")
            .replace("&#x27;", "'")
            .replace("&amp;", "&");
    }
}
