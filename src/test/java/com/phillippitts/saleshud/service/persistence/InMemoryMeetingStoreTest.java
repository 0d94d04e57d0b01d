package com.phillippitts.saleshud.service.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.InsightPriority;
import com.phillippitts.saleshud.domain.InsightType;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.Subscription;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InMemoryMeetingStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final InMemoryMeetingStore store = new InMemoryMeetingStore();

    private static TranscriptEntry entry(long sequence, String text) {
        return new TranscriptEntry(sequence, null, 0, text, NOW, 1.0, 0.9, null, false, List.of());
    }

    @Test
    void shouldKeepRecordsPerMeetingInSaveOrder() {
        // Arrange
        UUID meeting = UUID.randomUUID();
        UUID other = UUID.randomUUID();

        // Act
        store.saveTranscript(meeting, entry(1, "hello"));
        store.saveTranscript(meeting, entry(2, "world"));
        store.saveTranscript(other, entry(1, "elsewhere"));
        store.updateMeetingStatus(meeting, MeetingState.ACTIVE);

        // Assert
        assertThat(store.transcripts(meeting)).extracting(TranscriptEntry::text).containsExactly("hello", "world");
        assertThat(store.transcripts(other)).hasSize(1);
        assertThat(store.status(meeting)).isEqualTo(MeetingState.ACTIVE);
        assertThat(store.insights(meeting)).isEmpty();
    }

    @Test
    void shouldNotifySubscribersUntilCancelled() {
        // Arrange
        UUID meeting = UUID.randomUUID();
        List<String> seen = new ArrayList<>();
        Subscription subscription = store.subscribe(meeting, new MeetingStore.StoreListener() {
            @Override
            public void onTranscript(TranscriptEntry entry) {
                seen.add("transcript:" + entry.text());
            }

            @Override
            public void onInsight(Insight insight) {
                seen.add("insight:" + insight.content());
            }

            @Override
            public void onStatus(MeetingState state) {
                seen.add("status:" + state);
            }
        });

        // Act
        store.saveTranscript(meeting, entry(1, "hi"));
        store.saveInsight(meeting, new Insight(null, InsightType.RISK, InsightPriority.LOW, null, "risk", 0.5,
                null, null, NOW));
        store.updateMeetingStatus(meeting, MeetingState.PAUSED);
        subscription.cancel();
        store.saveTranscript(meeting, entry(2, "after"));

        // Assert
        assertThat(seen).containsExactly("transcript:hi", "insight:risk", "status:PAUSED");
    }

    @Test
    void shouldIsolateFailingSubscriber() {
        UUID meeting = UUID.randomUUID();
        store.subscribe(meeting, entry -> {
            throw new IllegalStateException("subscriber bug");
        });

        store.saveTranscript(meeting, entry(1, "still saved"));

        assertThat(store.transcripts(meeting)).hasSize(1);
    }
}
