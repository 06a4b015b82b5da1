package com.brandpulse.processing.attribution;

import com.brandpulse.processing.model.SentimentLabel;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phrases that compare the brand on their left with the brand on their right,
 * e.g. "A is way better than B". The label returned is the one for the left brand.
 */
final class ComparativeMarkers {

    private static final List<String> LEFT_WINS = List.of(
        "better than", "superior to", "beats", "outperforms", "outclasses", "crushes",
        "destroys", "preferred over", "rather than", "instead of", "more reliable than", "nicer than",
        "more comfortable than", "ahead of");

    private static final List<String> LEFT_LOSES = List.of(
        "worse than", "inferior to", "loses to", "lost to", "not as good as",
        "lags behind", "falls behind", "weaker than", "pales next to", "pales in comparison to", "less reliable than");

    // already negated; a further negation word inside the phrase is not a reversal
    private static final Set<String> NEGATED_PHRASES = Set.of("not as good as");

    // prepositions and verbs that only compare when they are all that separates the brands
    private static final Set<String> BARE_WINS = Set.of("over", "beat");
    private static final Set<String> BARE_LOSES = Set.of("behind");

    private static final Pattern LOSES = alternation(LEFT_LOSES);
    private static final Pattern WINS = alternation(LEFT_WINS);
    private static final Pattern NEGATION = Pattern.compile("(?<![\\p{L}])(?:not|never|isn't|aren't|wasn't|no)(?![\\p{L}])");
    private static final Pattern COPULA = Pattern.compile("^(?:is|are|was|were|just|still)\\s+");

    private ComparativeMarkers() {
    }

    /** @param gap lower-cased text strictly between the two mentions */
    static Optional<SentimentLabel> leftLabel(String gap) {
        Matcher loses = LOSES.matcher(gap);
        if (loses.find()) {
            boolean negated = !NEGATED_PHRASES.contains(loses.group()) && negatedOutside(gap, loses);
            return Optional.of(negated ? SentimentLabel.POSITIVE : SentimentLabel.NEGATIVE);
        }
        Matcher wins = WINS.matcher(gap);
        if (wins.find()) {
            return Optional.of(negatedOutside(gap, wins) ? SentimentLabel.NEGATIVE : SentimentLabel.POSITIVE);
        }
        String bare = bareWord(gap);
        if (BARE_LOSES.contains(bare)) return Optional.of(SentimentLabel.NEGATIVE);
        if (BARE_WINS.contains(bare)) return Optional.of(SentimentLabel.POSITIVE);
        return Optional.empty();
    }

    private static boolean negatedOutside(String gap, Matcher marker) {
        String rest = gap.substring(0, marker.start()) + " " + gap.substring(marker.end());
        return NEGATION.matcher(rest).find();
    }

    private static String bareWord(String gap) {
        String trimmed = gap.strip();
        String previous;
        do {
            previous = trimmed;
            trimmed = COPULA.matcher(trimmed).replaceFirst("");
        } while (!trimmed.equals(previous));
        return trimmed;
    }

    private static Pattern alternation(List<String> phrases) {
        StringBuilder sb = new StringBuilder("(?<![\\p{L}])(?:");
        for (int i = 0; i < phrases.size(); i++) {
            if (i > 0) sb.append('|');
            sb.append(Pattern.quote(phrases.get(i)));
        }
        return Pattern.compile(sb.append(")(?![\\p{L}])").toString());
    }
}
