package com.phillippitts.saleshud.service.analysis;

import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.domain.Emotion;
import com.phillippitts.saleshud.domain.Sentiment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword matcher for sentiment, importance, vocabulary and emotion tags.
 *
 * <p>All tests are case-insensitive substring containment against fixed word lists. The tags feed
 * prioritization and UI hints; they are not meant to be authoritative language analysis.
 *
 * <p>Thread-safe: immutable after construction.
 */
@Component
public class TranscriptTagger {

    static final List<String> POSITIVE_WORDS = List.of(
            "great", "excellent", "perfect", "love", "amazing", "fantastic", "yes", "absolutely", "definitely");
    static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "terrible", "hate", "no", "never", "problem", "issue", "concern", "worry");
    static final List<String> IMPORTANT_TOPICS = List.of(
            "budget", "price", "cost", "timeline", "decision", "contract", "competitor", "proposal",
            "next steps", "follow up");

    private final List<String> vocabulary;

    @Autowired
    public TranscriptTagger(TranscriptionProperties props) {
        this(props.getVocabulary());
    }

    TranscriptTagger(List<String> vocabulary) {
        Set<String> terms = new LinkedHashSet<>();
        for (String term : vocabulary) {
            if (term != null && !term.isBlank()) {
                terms.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        terms.addAll(IMPORTANT_TOPICS);
        this.vocabulary = List.copyOf(terms);
    }

    /** More positive than negative hits is positive, the reverse is negative, otherwise neutral. */
    public Sentiment sentiment(String text) {
        String lower = lower(text);
        long positive = POSITIVE_WORDS.stream().filter(lower::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(lower::contains).count();
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    public boolean isImportant(String text) {
        String lower = lower(text);
        return IMPORTANT_TOPICS.stream().anyMatch(lower::contains);
    }

    /** Vocabulary terms contained in the text, in vocabulary order. */
    public List<String> keywords(String text) {
        String lower = lower(text);
        List<String> found = new ArrayList<>();
        for (String term : vocabulary) {
            if (lower.contains(term)) {
                found.add(term);
            }
        }
        return found;
    }

    public Emotion emotion(String text, Sentiment sentiment) {
        String lower = lower(text);
        if (lower.contains("!") || lower.contains("wow") || lower.contains("amazing")) {
            return Emotion.EXCITED;
        }
        if ((lower.contains("?") && lower.contains("how")) || lower.contains("what")) {
            return Emotion.CONFUSED;
        }
        if (sentiment == Sentiment.NEGATIVE || lower.contains("concern") || lower.contains("worry")) {
            return Emotion.CONCERNED;
        }
        return Emotion.NEUTRAL;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
