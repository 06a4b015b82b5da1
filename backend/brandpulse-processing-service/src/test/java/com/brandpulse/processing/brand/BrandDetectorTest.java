package com.brandpulse.processing.brand;

import com.brandpulse.processing.model.BrandMention;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BrandDetectorTest {

    private final BrandDetector detector = new BrandDetector("/brands.tsv");

    @Test
    void detectsBrandsCaseInsensitivelyInMentionOrder() {
        assertThat(detector.detect("I love my nike and ADIDAS shoes, Nike forever"))
            .containsExactly("Nike", "Adidas");
    }

    @Test
    void aliasesResolveToCanonicalBrand() {
        assertThat(detector.detect("Just copped new Jordans")).containsExactly("Nike");
        assertThat(detector.detect("My iPhone died again")).containsExactly("Apple");
        assertThat(detector.detect("Grabbed a Coke and a McDonald's burger"))
            .containsExactly("Coca-Cola", "McDonald's");
    }

    @Test
    void aliasesMatchOnWordBoundariesOnly() {
        assertThat(detector.detect("applesauce and pumas at the zoo")).isEmpty();
    }

    @Test
    void longerAliasWinsOverNestedOne() {
        List<BrandMention> mentions = detector.detectWithPositions("nike inc reported earnings");

        assertThat(mentions).containsExactly(new BrandMention("Nike", 0, 8));
    }

    @Test
    void positionsIndexIntoNormalizedText() {
        String text = "Nike is way better than Adidas";

        List<BrandMention> mentions = detector.detectWithPositions(text);

        assertThat(mentions).containsExactly(
            new BrandMention("Nike", 0, 4),
            new BrandMention("Adidas", 24, 30));
        assertThat(text.substring(24, 30)).isEqualTo("Adidas");
    }

    @Test
    void requestedBrandIsAddedWhenTextNeverNamesIt() {
        assertThat(detector.detect("great shoes honestly", "puma")).containsExactly("Puma");
        assertThat(detector.detect("Nike rocks", "Reebok")).containsExactly("Nike", "Reebok");
        assertThat(detector.detect("great shoes", "  Hoka ")).containsExactly("Hoka");
    }

    @Test
    void requestedBrandAlreadyDetectedIsNotDuplicated() {
        assertThat(detector.detect("Nike rocks", "NIKE")).containsExactly("Nike");
        assertThat(detector.detect("Jordans are fire", "nike")).containsExactly("Nike");
    }

    @Test
    void blankRequestIsIgnored() {
        assertThat(detector.detect("nothing to see here", " ")).isEmpty();
        assertThat(detector.detectWithPositions("")).isEmpty();
    }

    @Test
    void customCatalogIsHonoured() {
        BrandDetector custom = new BrandDetector(BrandCatalog.of(Map.of("Acme", List.of("acme corp"))));

        assertThat(custom.detectWithPositions("Acme Corp shipped late"))
            .containsExactly(new BrandMention("Acme", 0, 9));
        assertThat(custom.canonical("ACME CORP")).isEqualTo("Acme");
    }

    @Test
    void aliasesFoldCaseLikeTheTextTheyAreMatchedIn() {
        BrandDetector custom = new BrandDetector(BrandCatalog.of(Map.of("İstanbul Grill", List.of("İSTANBUL"))));

        assertThat(custom.detectWithPositions("Ordered at İstanbul Grill, great"))
            .containsExactly(new BrandMention("İstanbul Grill", 11, 25));
        assertThat(custom.detect("İSTANBUL never disappoints")).containsExactly("İstanbul Grill");
        assertThat(custom.canonical("İSTANBUL GRILL")).isEqualTo("İstanbul Grill");
    }
}
