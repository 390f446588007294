package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.IntentResult;

import java.util.Optional;

/**
 * One stage of the intent cascade. Empty hands the message to the next stage.
 */
public interface IntentStrategy {

    String name();

    Optional<IntentResult> tryClassify(String message);
}
