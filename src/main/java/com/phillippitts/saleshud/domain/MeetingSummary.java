package com.phillippitts.saleshud.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Result of {@code stopMeeting}.
 *
 * @param id              summary id
 * @param meetingId       meeting the summary belongs to
 * @param title           meeting title
 * @param date            meeting start
 * @param durationMinutes elapsed minutes between start and end
 * @param participants    configured participants
 * @param keyPoints       text of the important transcript entries, in arrival order
 * @param decisions       AI-extracted decisions; empty for a local summary
 * @param actionItems     AI-extracted action items; empty for a local summary
 * @param nextSteps       AI-extracted next steps; empty for a local summary
 * @param insights        insights generated during the meeting
 * @param buyingSignals   signals detected during the meeting
 * @param tags            meeting type, platform and matched vocabulary
 * @param talkRatios      speaker label to percentage of total talk time
 * @param transcriptCount number of final transcript entries
 * @param qualityScore    0-100 blend of error count and transcript confidence
 * @param aiGenerated     whether the AI summary request succeeded
 */
public record MeetingSummary(
        String id,
        UUID meetingId,
        String title,
        Instant date,
        long durationMinutes,
        List<Participant> participants,
        List<String> keyPoints,
        List<String> decisions,
        List<ActionItem> actionItems,
        List<String> nextSteps,
        List<Insight> insights,
        List<BuyingSignal> buyingSignals,
        List<String> tags,
        Map<String, Double> talkRatios,
        int transcriptCount,
        double qualityScore,
        boolean aiGenerated
) {

    public MeetingSummary {
        Objects.requireNonNull(meetingId, "meetingId must not be null");
        id = id == null ? UUID.randomUUID().toString() : id;
        participants = List.copyOf(participants);
        keyPoints = List.copyOf(keyPoints);
        decisions = List.copyOf(decisions);
        actionItems = List.copyOf(actionItems);
        nextSteps = List.copyOf(nextSteps);
        insights = List.copyOf(insights);
        buyingSignals = List.copyOf(buyingSignals);
        tags = List.copyOf(tags);
        talkRatios = Map.copyOf(talkRatios);
    }
}
