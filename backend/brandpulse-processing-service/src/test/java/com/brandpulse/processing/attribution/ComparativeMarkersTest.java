package com.brandpulse.processing.attribution;

import com.brandpulse.processing.model.SentimentLabel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComparativeMarkersTest {

    @Test
    void phraseMarkersLabelTheLeftBrand() {
        assertThat(ComparativeMarkers.leftLabel(" is way better than ")).contains(SentimentLabel.POSITIVE);
        assertThat(ComparativeMarkers.leftLabel(" lags behind ")).contains(SentimentLabel.NEGATIVE);
        assertThat(ComparativeMarkers.leftLabel(" is inferior to ")).contains(SentimentLabel.NEGATIVE);
    }

    @Test
    void negationReversesBothDirections() {
        assertThat(ComparativeMarkers.leftLabel(" is not better than ")).contains(SentimentLabel.NEGATIVE);
        assertThat(ComparativeMarkers.leftLabel(" is not worse than ")).contains(SentimentLabel.POSITIVE);
        assertThat(ComparativeMarkers.leftLabel(" isn't worse than ")).contains(SentimentLabel.POSITIVE);
        assertThat(ComparativeMarkers.leftLabel(" is no worse than ")).contains(SentimentLabel.POSITIVE);
    }

    @Test
    void inherentlyNegatedPhraseStaysNegative() {
        assertThat(ComparativeMarkers.leftLabel(" is not as good as ")).contains(SentimentLabel.NEGATIVE);
    }

    @Test
    void bareWordsCountOnlyWhenTheyAloneSeparateTheBrands() {
        assertThat(ComparativeMarkers.leftLabel(" over ")).contains(SentimentLabel.POSITIVE);
        assertThat(ComparativeMarkers.leftLabel(" beat ")).contains(SentimentLabel.POSITIVE);
        assertThat(ComparativeMarkers.leftLabel(" is behind ")).contains(SentimentLabel.NEGATIVE);

        assertThat(ComparativeMarkers.leftLabel(" shoes fell apart over the weekend, ")).isEmpty();
        assertThat(ComparativeMarkers.leftLabel(" store is right behind the ")).isEmpty();
        assertThat(ComparativeMarkers.leftLabel(" sale beat my expectations, and ")).isEmpty();
    }
}
