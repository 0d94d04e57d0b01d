package com.phillippitts.saleshud.service.analysis;

import com.phillippitts.saleshud.domain.BuyingSignal;
import com.phillippitts.saleshud.domain.SignalStrength;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects buying intent and objections in final transcript text with a fixed set of phrase patterns.
 */
@Component
public class BuyingSignalDetector {

    static final String DEFAULT_RESPONSE = "Thank you for sharing that. How can I help address your needs?";

    private record Trigger(Pattern pattern, SignalStrength strength, boolean positive, String description,
                           String response) {
    }

    private static final List<Trigger> TRIGGERS = List.of(
            trigger("when (can|could) we (start|begin)", SignalStrength.STRONG, true, "Ready to start",
                    "That's great to hear! Let me outline the next steps for getting started."),
            trigger("what.*pricing", SignalStrength.MODERATE, true, "Pricing inquiry",
                    "I'd be happy to discuss our pricing options. Let me walk you through our packages."),
            trigger("send.*proposal", SignalStrength.STRONG, true, "Requesting proposal",
                    "I'll prepare a customized proposal for you. When would be a good time to review it?"),
            trigger("next steps", SignalStrength.MODERATE, true, "Interested in progression", DEFAULT_RESPONSE),
            trigger("sounds (good|great|perfect)", SignalStrength.MODERATE, true, "Positive feedback",
                    DEFAULT_RESPONSE),
            trigger("too expensive", SignalStrength.STRONG, false, "Price objection",
                    "I understand pricing is important. Let me show you the ROI this solution provides."),
            trigger("need to think", SignalStrength.MODERATE, false, "Hesitation",
                    "I completely understand. What specific concerns can I address for you?"),
            trigger("not sure", SignalStrength.WEAK, false, "Uncertainty", DEFAULT_RESPONSE));

    private static Trigger trigger(String regex, SignalStrength strength, boolean positive, String description,
                                   String response) {
        return new Trigger(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), strength, positive, description,
                response);
    }

    public List<BuyingSignal> detect(TranscriptEntry entry, Instant now) {
        List<BuyingSignal> signals = new ArrayList<>();
        for (Trigger t : TRIGGERS) {
            if (t.pattern().matcher(entry.text()).find()) {
                signals.add(new BuyingSignal(t.description(), t.strength(), t.positive(), t.response(),
                        entry.speakerIndex(), entry.sequence(), now));
            }
        }
        return signals;
    }
}
