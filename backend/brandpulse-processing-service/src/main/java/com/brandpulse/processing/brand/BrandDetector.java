package com.brandpulse.processing.brand;

import com.brandpulse.processing.model.BrandMention;
import com.brandpulse.processing.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Lexical, case-insensitive brand scan over normalized text.
 */
@Component
public class BrandDetector {

    private static final Logger log = LoggerFactory.getLogger(BrandDetector.class);

    private static final Comparator<BrandMention> BY_POSITION = Comparator
        .comparingInt(BrandMention::start)
        .thenComparing(Comparator.comparingInt((BrandMention m) -> m.end() - m.start()).reversed());

    private final BrandCatalog catalog;

    @Autowired
    public BrandDetector(@Value("${brandpulse.brands.catalog:/brands.tsv}") String catalogPath) {
        this(BrandCatalog.load(catalogPath));
    }

    public BrandDetector(BrandCatalog catalog) {
        this.catalog = catalog;
        log.info("Loaded brand catalog with {} brands", catalog.size());
    }

    public Set<String> detect(String text) {
        return brandsOf(detectWithPositions(text), null);
    }

    /** Detected brands in first-mention order, plus the requested brand when the text never names it. */
    public Set<String> detect(String text, String requestedBrand) {
        return brandsOf(detectWithPositions(text), requestedBrand);
    }

    /** Non-overlapping mentions ordered by offset; a longer alias wins over one nested in it. */
    public List<BrandMention> detectWithPositions(String text) {
        if (text == null || text.isEmpty()) return List.of();
        String lowered = TextNormalizer.matchForm(text);

        List<BrandMention> found = new ArrayList<>();
        catalog.aliasesByBrand().forEach((brand, aliases) -> {
            for (BrandCatalog.Alias alias : aliases) {
                if (!lowered.contains(alias.text())) continue;
                Matcher m = alias.pattern().matcher(lowered);
                while (m.find()) {
                    found.add(new BrandMention(brand, m.start(), m.end()));
                }
            }
        });
        found.sort(BY_POSITION);

        List<BrandMention> out = new ArrayList<>(found.size());
        int lastEnd = -1;
        for (BrandMention mention : found) {
            if (mention.start() < lastEnd) continue;
            out.add(mention);
            lastEnd = mention.end();
        }
        return out;
    }

    public Set<String> brandsOf(List<BrandMention> mentions, String requestedBrand) {
        Set<String> brands = new LinkedHashSet<>();
        for (BrandMention m : mentions) brands.add(m.brand());
        if (requestedBrand != null && !requestedBrand.isBlank()) {
            String wanted = canonical(requestedBrand);
            boolean present = brands.stream().anyMatch(b -> b.equalsIgnoreCase(wanted));
            if (!present) brands.add(wanted);
        }
        return brands;
    }

    /** Catalog spelling of a requested brand, or the trimmed request for unknown brands. */
    public String canonical(String requestedBrand) {
        return catalog.canonical(requestedBrand).orElse(requestedBrand.strip());
    }
}
