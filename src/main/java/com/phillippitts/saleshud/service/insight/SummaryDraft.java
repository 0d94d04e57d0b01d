package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.domain.ActionItem;

import java.util.List;

/**
 * AI-derived parts of a meeting summary.
 */
public record SummaryDraft(List<String> decisions, List<ActionItem> actionItems, List<String> nextSteps) {

    public SummaryDraft {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }

    public static SummaryDraft empty() {
        return new SummaryDraft(List.of(), List.of(), List.of());
    }
}
