package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.TranscriptEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Task prompts. Each asks for a single JSON object in the shape {@link InsightResponseParser} reads.
 */
final class PromptTemplates {

    private PromptTemplates() {
    }

    static String conversationAnalysis(MeetingConfig meeting, List<TranscriptEntry> entries) {
        return "Analyze this " + meeting.type().value() + " conversation.\n\n"
                + "TRANSCRIPT:\n" + transcript(entries) + "\n\n"
                + "Respond with JSON only:\n"
                + "{\"keyInsights\":[\"...\"],"
                + "\"buyingSignals\":[{\"signal\":\"...\",\"strength\":\"strong|moderate|weak\",\"confidence\":0-100}],"
                + "\"objections\":[{\"objection\":\"...\",\"type\":\"price|timing|authority|need|competition\","
                + "\"severity\":\"high|medium|low\"}],"
                + "\"nextBestActions\":[\"...\"],"
                + "\"risks\":[{\"risk\":\"...\",\"severity\":\"high|medium|low\",\"mitigation\":\"...\"}]}";
    }

    static String coaching(MeetingConfig meeting, List<TranscriptEntry> entries) {
        return "Give live coaching for the seller in this " + meeting.type().value() + " call.\n\n"
                + "RECENT TRANSCRIPT:\n" + transcript(entries) + "\n\n"
                + "Respond with JSON only:\n"
                + "{\"suggestions\":[{\"suggestion\":\"...\",\"priority\":\"urgent|high|medium|low\","
                + "\"category\":\"...\"}]}";
    }

    static String meetingSummary(MeetingConfig meeting, List<TranscriptEntry> entries) {
        return "Summarize the meeting \"" + meeting.title() + "\".\n\n"
                + "TRANSCRIPT:\n" + transcript(entries) + "\n\n"
                + "Respond with JSON only:\n"
                + "{\"decisions\":[\"...\"],"
                + "\"actionItems\":[{\"task\":\"...\",\"owner\":\"...\",\"priority\":\"high|medium|low\"}],"
                + "\"nextSteps\":[\"...\"]}";
    }

    private static String transcript(List<TranscriptEntry> entries) {
        return entries.stream()
                .map(e -> "[" + e.sequence() + "] " + e.speaker() + ": " + e.text())
                .collect(Collectors.joining("\n"));
    }
}
