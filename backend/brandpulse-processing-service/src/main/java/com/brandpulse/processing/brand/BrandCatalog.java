package com.brandpulse.processing.brand;

import com.brandpulse.processing.text.TextNormalizer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Known brands and their aliases. Resource format, one brand per line:
 * {@code Canonical Name<TAB>alias one, alias two}. The canonical name is always an alias.
 */
public final class BrandCatalog {

    private final Map<String, List<Alias>> aliasesByBrand;
    private final Map<String, String> canonicalByAlias;

    private BrandCatalog(Map<String, List<Alias>> aliasesByBrand, Map<String, String> canonicalByAlias) {
        this.aliasesByBrand = aliasesByBrand;
        this.canonicalByAlias = canonicalByAlias;
    }

    public static BrandCatalog load(String classpathFile) {
        Map<String, Set<String>> raw = new LinkedHashMap<>();
        try (InputStream in = BrandCatalog.class.getResourceAsStream(classpathFile)) {
            if (in == null) {
                throw new IllegalStateException("Brand catalog not found on classpath: " + classpathFile);
            }
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (line.isEmpty() || line.startsWith("#")) continue;
                    String[] cols = line.split("\t", 2);
                    String brand = cols[0].strip();
                    Set<String> aliases = raw.computeIfAbsent(brand, b -> new LinkedHashSet<>());
                    aliases.add(brand);
                    if (cols.length > 1) {
                        for (String a : cols[1].split(",")) {
                            if (!a.isBlank()) aliases.add(a.strip());
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read brand catalog " + classpathFile, e);
        }
        return of(raw);
    }

    public static BrandCatalog of(Map<String, ? extends Iterable<String>> brands) {
        Map<String, List<Alias>> byBrand = new LinkedHashMap<>();
        Map<String, String> canonical = new LinkedHashMap<>();
        brands.forEach((brand, aliases) -> {
            List<Alias> compiled = new ArrayList<>();
            Set<String> seen = new LinkedHashSet<>();
            // same per-char folding as the text side, so lengths and offsets line up
            seen.add(TextNormalizer.matchForm(brand));
            for (String a : aliases) seen.add(TextNormalizer.matchForm(a));
            for (String a : seen) {
                compiled.add(new Alias(a, Pattern.compile(
                    "(?<![\\p{L}\\p{N}])" + Pattern.quote(a) + "(?![\\p{L}\\p{N}])")));
                canonical.putIfAbsent(a, brand);
            }
            byBrand.put(brand, List.copyOf(compiled));
        });
        return new BrandCatalog(Collections.unmodifiableMap(byBrand), Collections.unmodifiableMap(canonical));
    }

    public Map<String, List<Alias>> aliasesByBrand() {
        return aliasesByBrand;
    }

    /** Canonical brand for a name or alias, case-insensitive. */
    public Optional<String> canonical(String nameOrAlias) {
        if (nameOrAlias == null) return Optional.empty();
        return Optional.ofNullable(canonicalByAlias.get(TextNormalizer.matchForm(nameOrAlias.strip())));
    }

    public int size() {
        return aliasesByBrand.size();
    }

    /** A lower-cased alias and its word-bounded matcher. */
    public record Alias(String text, Pattern pattern) {}
}
