package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.config.properties.AiBackendProperties;
import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the AI analysis tasks for a meeting and submits them to the {@link InsightRequestQueue}.
 *
 * <p>Priorities: real-time coaching 0 (never cached), meeting summary 1, conversation analysis 2.
 */
@Service
public class InsightService {

    static final int COACHING_PRIORITY = 0;
    static final int SUMMARY_PRIORITY = 1;
    static final int ANALYSIS_PRIORITY = 2;

    static final String ANALYSIS_TASK = "conversation-analysis";
    static final String COACHING_TASK = "coaching";
    static final String SUMMARY_TASK = "meeting-summary";

    private final InsightRequestQueue queue;
    private final AiBackendProperties backend;
    private final Clock clock;

    public InsightService(InsightRequestQueue queue, AiBackendProperties backend, Clock clock) {
        this.queue = queue;
        this.backend = backend;
        this.clock = clock;
    }

    public CompletableFuture<List<Insight>> analyzeConversation(UUID meetingId, MeetingConfig meeting,
                                                                List<TranscriptEntry> batch) {
        InsightRequest request = new InsightRequest(ANALYSIS_TASK,
                completion(PromptTemplates.conversationAnalysis(meeting, batch)), ANALYSIS_PRIORITY,
                ANALYSIS_TASK + ':' + meetingId, false);
        return queue.submit(request, r -> InsightResponseParser.parseAnalysis(r.text(), clock.instant()));
    }

    public CompletableFuture<List<Insight>> coach(MeetingConfig meeting, List<TranscriptEntry> recent) {
        InsightRequest request = InsightRequest.realTime(COACHING_TASK,
                completion(PromptTemplates.coaching(meeting, recent)), COACHING_PRIORITY);
        return queue.submit(request, r -> InsightResponseParser.parseCoaching(r.text(), clock.instant()));
    }

    public CompletableFuture<SummaryDraft> summarize(UUID meetingId, MeetingConfig meeting,
                                                     List<TranscriptEntry> transcript) {
        InsightRequest request = new InsightRequest(SUMMARY_TASK,
                completion(PromptTemplates.meetingSummary(meeting, transcript)), SUMMARY_PRIORITY,
                SUMMARY_TASK + ':' + meetingId, false);
        return queue.submit(request, r -> InsightResponseParser.parseSummary(r.text()));
    }

    private CompletionRequest completion(String prompt) {
        return new CompletionRequest(backend.getModel(), backend.getMaxTokens(), backend.getTemperature(),
                backend.getSystemInstruction(), prompt);
    }
}
