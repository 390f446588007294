package com.ai.assistant.service.nlp;

import com.ai.assistant.client.LanguageProvider;
import com.ai.assistant.conversation.IntentResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Remote language model. Its answer is trusted as is, without a confidence floor.
 */
@Component
@Order(1)
public class RemoteIntentStrategy implements IntentStrategy {

    private final LanguageProvider languageProvider;

    public RemoteIntentStrategy(LanguageProvider languageProvider) {
        this.languageProvider = languageProvider;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public Optional<IntentResult> tryClassify(String message) {
        if (!languageProvider.isConfigured()) return Optional.empty();
        return languageProvider.classifyIntent(message);
    }
}
