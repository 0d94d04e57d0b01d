package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.domain.ActionItem;
import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.InsightPriority;
import com.phillippitts.saleshud.domain.InsightType;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns AI completion text into typed insights and summary parts.
 *
 * <p>The model is asked for JSON but may wrap it in prose, so parsing starts at the first balanced
 * {@code {...}} object. An optional {@code result} wrapper is unwrapped. Confidences given on a 0-100
 * scale are normalised to 0-1. Entries without text are skipped; unknown fields are ignored.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class InsightResponseParser {

    private static final double DEFAULT_CONFIDENCE = 0.7;

    private InsightResponseParser() {
    }

    /**
     * Parses a conversation analysis: {@code keyInsights}, {@code buyingSignals}, {@code objections},
     * {@code nextBestActions} and {@code risks} (or {@code riskFactors}).
     *
     * @throws ServiceException PROCESSING_ERROR when the text holds no JSON object
     */
    public static List<Insight> parseAnalysis(String text, Instant now) {
        JSONObject root = unwrap(extractJson(text));
        List<Insight> insights = new ArrayList<>();

        JSONArray keyInsights = root.optJSONArray("keyInsights");
        for (int i = 0; keyInsights != null && i < keyInsights.length(); i++) {
            String content = textOf(keyInsights.opt(i), "insight");
            if (content != null) {
                insights.add(new Insight(null, InsightType.KEY_INSIGHT, InsightPriority.MEDIUM, null, content,
                        confidenceOf(keyInsights.opt(i)), "analysis", null, now));
            }
        }

        JSONArray signals = root.optJSONArray("buyingSignals");
        for (int i = 0; signals != null && i < signals.length(); i++) {
            Object raw = signals.opt(i);
            String content = textOf(raw, "signal");
            if (content != null) {
                JSONObject obj = raw instanceof JSONObject ? (JSONObject) raw : new JSONObject();
                InsightPriority priority = "strong".equalsIgnoreCase(obj.optString("strength"))
                        ? InsightPriority.HIGH : InsightPriority.MEDIUM;
                insights.add(new Insight(null, InsightType.BUYING_SIGNAL, priority, null, content,
                        confidenceOf(raw), "buying-signal", emptyToNull(obj.optString("suggestedResponse")), now));
            }
        }

        JSONArray objections = root.optJSONArray("objections");
        for (int i = 0; objections != null && i < objections.length(); i++) {
            Object raw = objections.opt(i);
            String content = textOf(raw, "objection");
            if (content != null) {
                JSONObject obj = raw instanceof JSONObject ? (JSONObject) raw : new JSONObject();
                insights.add(new Insight(null, InsightType.OBJECTION,
                        InsightPriority.fromValue(obj.optString("severity", "high")), null, content,
                        confidenceOf(raw), emptyToNull(obj.optString("type")), null, now));
            }
        }

        JSONArray actions = root.optJSONArray("nextBestActions");
        for (int i = 0; actions != null && i < actions.length(); i++) {
            String content = textOf(actions.opt(i), "action");
            if (content != null) {
                insights.add(new Insight(null, InsightType.NEXT_ACTION, InsightPriority.MEDIUM, null, content,
                        confidenceOf(actions.opt(i)), "next-action", content, now));
            }
        }

        JSONArray risks = root.has("risks") ? root.optJSONArray("risks") : root.optJSONArray("riskFactors");
        for (int i = 0; risks != null && i < risks.length(); i++) {
            Object raw = risks.opt(i);
            String content = textOf(raw, "risk");
            if (content != null) {
                JSONObject obj = raw instanceof JSONObject ? (JSONObject) raw : new JSONObject();
                insights.add(new Insight(null, InsightType.RISK,
                        InsightPriority.fromValue(obj.optString("severity", "medium")), null, content,
                        confidenceOf(raw), "risk", emptyToNull(obj.optString("mitigation")), now));
            }
        }
        return insights;
    }

    /**
     * Parses coaching suggestions from {@code suggestions}, each a string or an object with
     * {@code suggestion}, {@code priority} and {@code category}.
     */
    public static List<Insight> parseCoaching(String text, Instant now) {
        JSONObject root = unwrap(extractJson(text));
        List<Insight> insights = new ArrayList<>();
        JSONArray suggestions = root.optJSONArray("suggestions");
        for (int i = 0; suggestions != null && i < suggestions.length(); i++) {
            Object raw = suggestions.opt(i);
            String content = textOf(raw, "suggestion");
            if (content != null) {
                JSONObject obj = raw instanceof JSONObject ? (JSONObject) raw : new JSONObject();
                insights.add(new Insight(null, InsightType.COACHING,
                        InsightPriority.fromValue(obj.optString("priority", "high")), null, content,
                        confidenceOf(raw), emptyToNull(obj.optString("category")), content, now));
            }
        }
        return insights;
    }

    /**
     * Parses {@code decisions}, {@code actionItems} ({@code task}, {@code owner}, {@code priority}) and
     * {@code nextSteps}.
     */
    public static SummaryDraft parseSummary(String text) {
        JSONObject root = unwrap(extractJson(text));
        List<ActionItem> actionItems = new ArrayList<>();
        JSONArray items = root.optJSONArray("actionItems");
        for (int i = 0; items != null && i < items.length(); i++) {
            Object raw = items.opt(i);
            String task = textOf(raw, "task");
            if (task != null) {
                JSONObject obj = raw instanceof JSONObject ? (JSONObject) raw : new JSONObject();
                actionItems.add(new ActionItem(task, emptyToNull(obj.optString("owner")),
                        InsightPriority.fromValue(obj.optString("priority", "medium"))));
            }
        }
        return new SummaryDraft(strings(root.optJSONArray("decisions")), actionItems,
                strings(root.optJSONArray("nextSteps")));
    }

    /** Extracts the first balanced JSON object, honouring string literals and escapes. */
    static JSONObject extractJson(String text) {
        if (text == null) {
            throw noJson();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(text, start);
            if (end < 0) {
                break;
            }
            try {
                return new JSONObject(text.substring(start, end + 1));
            } catch (JSONException e) {
                start = text.indexOf('{', start + 1);
            }
        }
        throw noJson();
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = inString;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '{') {
                depth++;
            } else if (!inString && c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static JSONObject unwrap(JSONObject root) {
        JSONObject result = root.optJSONObject("result");
        return result != null ? result : root;
    }

    private static String textOf(Object raw, String field) {
        String value;
        if (raw instanceof JSONObject) {
            JSONObject obj = (JSONObject) raw;
            value = obj.optString(field, obj.optString("description", obj.optString("content", "")));
        } else if (raw instanceof String) {
            value = (String) raw;
        } else {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    static double confidenceOf(Object raw) {
        if (!(raw instanceof JSONObject)) {
            return DEFAULT_CONFIDENCE;
        }
        double value = ((JSONObject) raw).optDouble("confidence", DEFAULT_CONFIDENCE);
        if (Double.isNaN(value) || value < 0) {
            return DEFAULT_CONFIDENCE;
        }
        if (value > 1.0) {
            value = value / 100.0;
        }
        return Math.min(1.0, value);
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>();
        for (int i = 0; array != null && i < array.length(); i++) {
            String value = textOf(array.opt(i), "text");
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static ServiceException noJson() {
        return ServiceExceptionBuilder.create("AI response contains no JSON object", ErrorKind.PROCESSING_ERROR).build();
    }
}
