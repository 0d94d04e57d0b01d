package com.phillippitts.saleshud.service.persistence;

import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.Subscription;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link MeetingStore} keeping records in memory. Listener failures are logged and do not
 * affect other listeners.
 */
@Component
public class InMemoryMeetingStore implements MeetingStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryMeetingStore.class);

    private final Map<UUID, List<TranscriptEntry>> transcripts = new ConcurrentHashMap<>();
    private final Map<UUID, List<Insight>> insights = new ConcurrentHashMap<>();
    private final Map<UUID, MeetingState> statuses = new ConcurrentHashMap<>();
    private final Map<UUID, List<StoreListener>> listeners = new ConcurrentHashMap<>();

    @Override
    public void saveTranscript(UUID meetingId, TranscriptEntry entry) {
        transcripts.computeIfAbsent(meetingId, id -> new CopyOnWriteArrayList<>()).add(entry);
        for (StoreListener l : listenersOf(meetingId)) {
            try {
                l.onTranscript(entry);
            } catch (RuntimeException e) {
                LOG.warn("Store listener failed on transcript: {}", e.toString());
            }
        }
    }

    @Override
    public void saveInsight(UUID meetingId, Insight insight) {
        insights.computeIfAbsent(meetingId, id -> new CopyOnWriteArrayList<>()).add(insight);
        for (StoreListener l : listenersOf(meetingId)) {
            try {
                l.onInsight(insight);
            } catch (RuntimeException e) {
                LOG.warn("Store listener failed on insight: {}", e.toString());
            }
        }
    }

    @Override
    public void updateMeetingStatus(UUID meetingId, MeetingState state) {
        statuses.put(meetingId, state);
        for (StoreListener l : listenersOf(meetingId)) {
            try {
                l.onStatus(state);
            } catch (RuntimeException e) {
                LOG.warn("Store listener failed on status: {}", e.toString());
            }
        }
    }

    @Override
    public Subscription subscribe(UUID meetingId, StoreListener listener) {
        List<StoreListener> list = listeners.computeIfAbsent(meetingId, id -> new CopyOnWriteArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    @Override
    public void ping() {
        // Always reachable
    }

    public List<TranscriptEntry> transcripts(UUID meetingId) {
        return new ArrayList<>(transcripts.getOrDefault(meetingId, List.of()));
    }

    public List<Insight> insights(UUID meetingId) {
        return new ArrayList<>(insights.getOrDefault(meetingId, List.of()));
    }

    public MeetingState status(UUID meetingId) {
        return statuses.get(meetingId);
    }

    private List<StoreListener> listenersOf(UUID meetingId) {
        return listeners.getOrDefault(meetingId, List.of());
    }
}
