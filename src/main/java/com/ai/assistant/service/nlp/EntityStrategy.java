package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;

import java.util.Optional;

/**
 * One stage of the entity cascade. Empty hands the message to the next stage.
 */
public interface EntityStrategy {

    String name();

    /**
     * @param intent may be null when extraction is not scoped by an intent
     */
    Optional<EntityBag> tryExtract(String message, Intent intent);
}
