package com.brandpulse.processing.classifier;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads tab-separated model resources from the classpath. Blank lines and {@code #}
 * comments are skipped; anything missing or malformed is a {@link ModelLoadException}.
 */
public final class Lexicon {

    private Lexicon() {
    }

    /** Rows of tab-separated columns; every row has at least {@code minColumns}. */
    public static List<String[]> rows(String path, int minColumns) {
        List<String[]> out = new ArrayList<>();
        try (InputStream in = Lexicon.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new ModelLoadException("Model resource not found on classpath: " + path);
            }
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                int lineNo = 0;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    line = line.strip();
                    if (line.isEmpty() || line.startsWith("#")) continue;
                    String[] cols = line.split("\t");
                    if (cols.length < minColumns) {
                        throw new ModelLoadException(path + ":" + lineNo + " expected " + minColumns + " columns");
                    }
                    for (int i = 0; i < cols.length; i++) cols[i] = cols[i].strip();
                    out.add(cols);
                }
            }
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read model resource " + path, e);
        }
        if (out.isEmpty()) {
            throw new ModelLoadException("Model resource is empty: " + path);
        }
        return out;
    }

    /** {@code term<TAB>weight} pairs; terms are lower-cased. */
    public static Map<String, Double> weights(String path) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String[] row : rows(path, 2)) {
            try {
                out.put(row[0].toLowerCase(Locale.ROOT), Double.parseDouble(row[1]));
            } catch (NumberFormatException e) {
                throw new ModelLoadException(path + ": bad weight for '" + row[0] + "'", e);
            }
        }
        return out;
    }

    /** {@code term<TAB>label} pairs; both sides lower-cased. */
    public static Map<String, String> labels(String path) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String[] row : rows(path, 2)) {
            out.put(row[0].toLowerCase(Locale.ROOT), row[1].toLowerCase(Locale.ROOT));
        }
        return out;
    }

    static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
