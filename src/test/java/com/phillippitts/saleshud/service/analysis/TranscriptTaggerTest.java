package com.phillippitts.saleshud.service.analysis;

import com.phillippitts.saleshud.domain.Emotion;
import com.phillippitts.saleshud.domain.Sentiment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptTaggerTest {

    private final TranscriptTagger tagger = new TranscriptTagger(List.of("ROI", " Decision Maker ", ""));

    @Test
    void shouldTagPositiveWhenPositiveHitsDominate() {
        assertThat(tagger.sentiment("This is great, I love it")).isEqualTo(Sentiment.POSITIVE);
    }

    @Test
    void shouldTagNegativeWhenNegativeHitsDominate() {
        assertThat(tagger.sentiment("That is a terrible problem")).isEqualTo(Sentiment.NEGATIVE);
    }

    @Test
    void shouldTagNeutralOnTieOrNoHits() {
        assertThat(tagger.sentiment("The meeting is at three")).isEqualTo(Sentiment.NEUTRAL);
        assertThat(tagger.sentiment("Great price but a real problem")).isEqualTo(Sentiment.NEUTRAL);
        assertThat(tagger.sentiment(null)).isEqualTo(Sentiment.NEUTRAL);
    }

    @Test
    void shouldMarkImportantTopicsCaseInsensitively() {
        assertThat(tagger.isImportant("Let's talk about the BUDGET")).isTrue();
        assertThat(tagger.isImportant("Can you send the proposal")).isTrue();
        assertThat(tagger.isImportant("Nice weather today")).isFalse();
    }

    @Test
    void shouldReturnVocabularyMatchesInVocabularyOrder() {
        // Act
        List<String> keywords = tagger.keywords("Our budget depends on ROI and the decision maker");

        // Assert: configured terms first, then built-in topics; "decision" also matches as a topic
        assertThat(keywords).containsExactly("roi", "decision maker", "budget", "decision");
    }

    @Test
    void shouldReturnNoKeywordsForUnrelatedText() {
        assertThat(tagger.keywords("hello there")).isEmpty();
    }

    @Test
    void shouldDeriveEmotionFromCuesInPriorityOrder() {
        assertThat(tagger.emotion("Wow, that is impressive", Sentiment.NEUTRAL)).isEqualTo(Emotion.EXCITED);
        assertThat(tagger.emotion("What does that include", Sentiment.NEUTRAL)).isEqualTo(Emotion.CONFUSED);
        assertThat(tagger.emotion("How does it scale?", Sentiment.NEUTRAL)).isEqualTo(Emotion.CONFUSED);
        assertThat(tagger.emotion("I have a concern", Sentiment.NEUTRAL)).isEqualTo(Emotion.CONCERNED);
        assertThat(tagger.emotion("That is a shame", Sentiment.NEGATIVE)).isEqualTo(Emotion.CONCERNED);
        assertThat(tagger.emotion("Okay", Sentiment.NEUTRAL)).isEqualTo(Emotion.NEUTRAL);
    }
}
