package com.ai.assistant.service;

import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.service.nlp.IntentStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a message to an intent by running the ordered strategies until one answers.
 * Never throws: a strategy failure only moves the message to the next strategy.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private final List<IntentStrategy> strategies;

    public IntentClassifier(List<IntentStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public IntentResult classify(String message) {
        if (message == null || message.isBlank()) {
            return IntentResult.unknown(0.0);
        }
        for (IntentStrategy strategy : strategies) {
            try {
                Optional<IntentResult> result = strategy.tryClassify(message);
                if (result != null && result.isPresent()) {
                    log.info("Intent {} via {} for '{}'", result.get(), strategy.name(), message);
                    return result.get();
                }
            } catch (RuntimeException e) {
                log.warn("Intent strategy {} failed, trying next: {}", strategy.name(), e.getMessage());
            }
        }
        log.warn("No intent strategy answered for '{}'", message);
        return IntentResult.unknown(0.0);
    }
}
