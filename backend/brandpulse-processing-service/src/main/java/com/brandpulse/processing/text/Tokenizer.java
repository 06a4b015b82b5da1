package com.brandpulse.processing.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class Tokenizer {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9']+");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z]+");

    private final Stopwords stopwords;
    private final int minLen;
    private final int maxLen;

    public Tokenizer(Stopwords stopwords, int minLen, int maxLen) {
        this.stopwords = stopwords;
        this.minLen = minLen;
        this.maxLen = maxLen;
    }

    /** Content tokens: letters only, length-bounded, stopwords removed. */
    public List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        // keep letters and spaces; turn everything else into space
        String norm = NON_LETTER.matcher(fold(text)).replaceAll(" ").trim();
        if (norm.isEmpty()) return List.of();

        String[] parts = norm.split("\\s+");
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            if (p.length() < minLen || p.length() > maxLen) continue;
            if (stopwords.contains(p)) continue;
            out.add(p);
        }
        return out;
    }

    /**
     * Every word in order, apostrophes kept so that negations like {@code don't}
     * survive. No stopword filtering.
     */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        String norm = NON_WORD.matcher(fold(text)).replaceAll(" ").trim();
        if (norm.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String p : norm.split("\\s+")) {
            String w = stripQuotes(p);
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    private static String fold(String text) {
        String decomposed = Normalizer.normalize(text.replace('’', '\''), Normalizer.Form.NFKD);
        return MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static String stripQuotes(String w) {
        int s = 0;
        int e = w.length();
        while (s < e && w.charAt(s) == '\'') s++;
        while (e > s && w.charAt(e - 1) == '\'') e--;
        return w.substring(s, e);
    }
}
