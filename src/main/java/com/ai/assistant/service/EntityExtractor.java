package com.ai.assistant.service;

import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.service.nlp.EntityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Pulls slot values out of a message. The first strategy that returns a bag wins;
 * results of different strategies are never merged. Never throws.
 */
@Service
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private final List<EntityStrategy> strategies;

    public EntityExtractor(List<EntityStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public EntityBag extract(String message) {
        return extract(message, null);
    }

    public EntityBag extract(String message, Intent intent) {
        if (message == null || message.isBlank()) return EntityBag.empty();
        for (EntityStrategy strategy : strategies) {
            try {
                Optional<EntityBag> bag = strategy.tryExtract(message, intent);
                if (bag != null && bag.isPresent()) {
                    log.info("Entities via {}: {}", strategy.name(), bag.get());
                    return bag.get();
                }
            } catch (RuntimeException e) {
                log.warn("Entity strategy {} failed, trying next: {}", strategy.name(), e.getMessage());
            }
        }
        return EntityBag.empty();
    }
}
