package com.brandpulse.processing.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

/**
 * Lucene's English stop set merged with classpath word lists (one word per line,
 * {@code #} comments allowed).
 */
public final class Stopwords {

    private final Set<String> merged;

    private Stopwords(Set<String> merged) {
        this.merged = merged;
    }

    public static Stopwords load(String... classpathFiles) {
        Set<String> out = new HashSet<>();

        CharArraySet defaults = EnglishAnalyzer.getDefaultStopSet();
        for (Object token : defaults) {
            if (token instanceof char[] chars) {
                out.add(new String(chars));
            } else if (token != null) {
                out.add(token.toString());
            }
        }

        for (String path : classpathFiles) {
            try (InputStream in = Stopwords.class.getResourceAsStream(path)) {
                if (in == null) {
                    throw new IllegalStateException("Stopword list not found on classpath: " + path);
                }
                try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        line = line.strip();
                        if (!line.isEmpty() && !line.startsWith("#")) {
                            out.add(line.toLowerCase(Locale.ROOT));
                        }
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read stopword list " + path, e);
            }
        }

        return new Stopwords(out);
    }

    public boolean contains(String token) {
        return merged.contains(token);
    }

    public int size() {
        return merged.size();
    }
}
