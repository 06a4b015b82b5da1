package com.brandpulse.processing.classifier;

import com.brandpulse.processing.text.Stopwords;
import com.brandpulse.processing.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the lexicon classifiers from the resources under {@code /models/}.
 */
@Component
public class LexiconClassifierLoader implements ClassifierLoader {

    private static final Logger log = LoggerFactory.getLogger(LexiconClassifierLoader.class);

    static final String SENTIMENT_LEXICON = "/models/sentiment-lexicon.tsv";
    static final String SENTIMENT_MODIFIERS = "/models/sentiment-modifiers.tsv";
    static final String SARCASM_CUES = "/models/sarcasm-cues.tsv";
    static final String SARCASM_SITUATIONS = "/models/sarcasm-situations.tsv";
    static final String EMOTION_LEXICON = "/models/emotion-lexicon.tsv";
    static final String TOPICS = "/models/topics.tsv";
    static final String STOPWORDS = "/stopwords-social-en.txt";

    private static final String NEGATE = "negate";

    private final double emotionThreshold;
    private final double sarcasmContrastWeight;

    public LexiconClassifierLoader(@Value("${brandpulse.models.emotion-threshold:0.3}") double emotionThreshold,
                                   @Value("${brandpulse.models.sarcasm-contrast-weight:0.45}") double sarcasmContrastWeight) {
        this.emotionThreshold = emotionThreshold;
        this.sarcasmContrastWeight = sarcasmContrastWeight;
    }

    @Override
    public Classifiers load() {
        LexiconSentimentClassifier sentiment = loadSentiment();
        LexiconSarcasmClassifier sarcasm = new LexiconSarcasmClassifier(
            Lexicon.weights(SARCASM_CUES),
            firstColumn(SARCASM_SITUATIONS),
            sarcasmContrastWeight,
            sentiment);
        LexiconEmotionClassifier emotion = new LexiconEmotionClassifier(Lexicon.labels(EMOTION_LEXICON), emotionThreshold);
        SeededTopicClassifier topic = loadTopics();
        log.info("Lexicon classifiers ready (emotionThreshold={})", emotionThreshold);
        return new Classifiers(sentiment, sarcasm, emotion, topic);
    }

    private LexiconSentimentClassifier loadSentiment() {
        Map<String, Double> weights = Lexicon.weights(SENTIMENT_LEXICON);
        Set<String> negators = new HashSet<>();
        Map<String, Double> intensifiers = new HashMap<>();
        for (String[] row : Lexicon.rows(SENTIMENT_MODIFIERS, 2)) {
            String word = row[0].toLowerCase(Locale.ROOT);
            if (NEGATE.equalsIgnoreCase(row[1])) {
                negators.add(word);
            } else {
                try {
                    intensifiers.put(word, Double.parseDouble(row[1]));
                } catch (NumberFormatException e) {
                    throw new ModelLoadException(SENTIMENT_MODIFIERS + ": bad modifier for '" + word + "'", e);
                }
            }
        }
        log.info("Sentiment lexicon: {} terms, {} negators, {} intensifiers",
            weights.size(), negators.size(), intensifiers.size());
        return new LexiconSentimentClassifier(weights, negators, intensifiers);
    }

    private SeededTopicClassifier loadTopics() {
        Stopwords stopwords;
        try {
            stopwords = Stopwords.load(STOPWORDS);
        } catch (RuntimeException e) {
            throw new ModelLoadException("Failed to load stopwords " + STOPWORDS, e);
        }
        log.info("Loaded {} stopwords (Lucene English + social)", stopwords.size());

        List<SeededTopicClassifier.Topic> topics = new ArrayList<>();
        for (String[] row : Lexicon.rows(TOPICS, 3)) {
            int id;
            try {
                id = Integer.parseInt(row[0]);
            } catch (NumberFormatException e) {
                throw new ModelLoadException(TOPICS + ": bad topic id '" + row[0] + "'", e);
            }
            Set<String> seeds = new LinkedHashSet<>();
            for (String s : row[2].split(",")) {
                if (!s.isBlank()) seeds.add(s.strip().toLowerCase(Locale.ROOT));
            }
            topics.add(new SeededTopicClassifier.Topic(id, row[1], seeds));
        }
        return new SeededTopicClassifier(topics, new Tokenizer(stopwords, 3, 24));
    }

    private static Set<String> firstColumn(String path) {
        Set<String> out = new HashSet<>();
        for (String[] row : Lexicon.rows(path, 1)) out.add(row[0].toLowerCase(Locale.ROOT));
        return out;
    }
}
