package com.ai.assistant.client;

import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;

import java.util.Optional;

/**
 * Best-effort remote language model. Empty means the provider declined, is not
 * configured or failed; callers fall back to local strategies.
 */
public interface LanguageProvider {

    boolean isConfigured();

    Optional<IntentResult> classifyIntent(String message);

    Optional<EntityBag> extractEntities(String message, Intent intent);
}
