package com.brandpulse.processing.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer(2000);

    @Test
    void blankOrSymbolOnlyTextIsUnusable() {
        assertThat(normalizer.normalize(null, "reddit")).isEmpty();
        assertThat(normalizer.normalize("   \n\t ", "reddit")).isEmpty();
        assertThat(normalizer.normalize("!!! ??? ...", "news")).isEmpty();
        assertThat(normalizer.normalize("https://example.com/only-a-link", "reddit")).isEmpty();
    }

    @Test
    void redditMarkdownUsersAndEditLinesAreStripped() {
        String raw = "**Love** my [Nike](https://nike.com) kicks, thanks u/someone in r/Sneakers\nEDIT: typo";

        assertThat(normalizer.normalize(raw, "reddit")).isEqualTo("Love my Nike kicks, thanks in Sneakers");
    }

    @Test
    void newsBylineDatelineAndBoilerplateAreStripped() {
        String raw = "By Jane Doe | Reuters\nNEW YORK (Reuters) - Nike shares fell.\nRead more at example";

        assertThat(normalizer.normalize(raw, "news")).isEqualTo("Nike shares fell.");
    }

    @Test
    void twitterRetweetPrefixMentionsAndHashtagsAreCleaned() {
        String raw = "RT @nikestore: Loving the new drop #JustDoIt @friend";

        assertThat(normalizer.normalize(raw, "twitter")).isEqualTo("Loving the new drop JustDoIt");
    }

    @Test
    void htmlEntitiesUrlsAndWhitespaceAreNormalized() {
        assertThat(normalizer.normalize("<p>Tom &amp; Jerry&#39;s</p>", "reddit")).isEqualTo("Tom & Jerry's");
        assertThat(normalizer.normalize("check   https://t.co/abc\n\nnow", "reddit")).isEqualTo("check now");
    }

    @Test
    void fullWidthCharactersFoldToAscii() {
        assertThat(normalizer.normalize("ｎｉｋｅ rocks", "reddit")).isEqualTo("nike rocks");
    }

    @Test
    void displayFormKeepsCasing() {
        assertThat(normalizer.normalize("NIKE Is Great", "unknown-platform")).isEqualTo("NIKE Is Great");
    }

    @Test
    void longTextIsTruncated() {
        TextNormalizer shortLimit = new TextNormalizer(10);

        assertThat(shortLimit.normalize("abcdefghij klm", "reddit")).isEqualTo("abcdefghij");
    }

    @Test
    void matchFormLowerCasesWithoutMovingOffsets() {
        String display = "ÀBC Nike";
        String match = TextNormalizer.matchForm(display);

        assertThat(match).isEqualTo("àbc nike");
        assertThat(match).hasSameSizeAs(display);
        assertThat(TextNormalizer.matchForm(null)).isEmpty();
    }
}
