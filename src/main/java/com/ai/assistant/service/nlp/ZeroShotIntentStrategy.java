package com.ai.assistant.service.nlp;

import com.ai.assistant.client.ZeroShotModel;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Zero-shot classification against one descriptive label per intent. Scores under
 * {@link #CONFIDENCE_FLOOR} are discarded so a later stage decides.
 */
@Component
@Order(3)
public class ZeroShotIntentStrategy implements IntentStrategy {

    private static final Logger log = LoggerFactory.getLogger(ZeroShotIntentStrategy.class);

    static final double CONFIDENCE_FLOOR = 0.65;
    static final String HYPOTHESIS_TEMPLATE = "This text is about {}.";

    private static final Map<String, Intent> LABELS = new LinkedHashMap<>();

    static {
        LABELS.put("sending an email", Intent.SEND_EMAIL);
        LABELS.put("scheduling a meeting", Intent.SCHEDULE_MEETING);
        LABELS.put("checking calendar", Intent.CHECK_CALENDAR);
        LABELS.put("finding contact information", Intent.FIND_CONTACT);
        LABELS.put("checking availability", Intent.CHECK_FREE_SLOTS);
    }

    private final ZeroShotModel model;

    public ZeroShotIntentStrategy(ZeroShotModel model) {
        this.model = model;
    }

    @Override
    public String name() {
        return "zero-shot";
    }

    @Override
    public Optional<IntentResult> tryClassify(String message) {
        if (!model.isConfigured()) return Optional.empty();

        Map<String, Double> scores = model.score(message, new ArrayList<>(LABELS.keySet()), HYPOTHESIS_TEMPLATE);
        String bestLabel = null;
        double best = -1;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (LABELS.containsKey(entry.getKey()) && entry.getValue() != null && entry.getValue() > best) {
                bestLabel = entry.getKey();
                best = entry.getValue();
            }
        }
        if (bestLabel == null) return Optional.empty();
        if (best < CONFIDENCE_FLOOR) {
            log.debug("Zero-shot best '{}' scored {} below floor, falling through", bestLabel, best);
            return Optional.empty();
        }
        return Optional.of(IntentResult.of(LABELS.get(bestLabel), best));
    }
}
