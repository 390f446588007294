package com.ai.assistant.component;

import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open conversation per sender, at most one. States idle longer than the configured
 * timeout read as absent and are swept periodically.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();
    private final Clock clock;
    private final DialogueProperties properties;

    public ConversationStore(Clock clock, DialogueProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public Optional<ConversationState> get(String senderId) {
        ConversationState state = states.get(senderId);
        if (state == null) return Optional.empty();
        if (isExpired(state, clock.instant())) {
            states.remove(senderId, state);
            log.info("[{}] {} conversation expired at step {}", senderId, state.getKind(), state.stepName());
            return Optional.empty();
        }
        return Optional.of(state);
    }

    public boolean has(String senderId) {
        return get(senderId).isPresent();
    }

    /** Replaces whatever conversation the sender had open. */
    public void put(ConversationState state) {
        state.touch(clock.instant());
        ConversationState previous = states.put(state.getSenderId(), state);
        if (previous != null && previous != state) {
            log.info("[{}] {} conversation replaced by {}", state.getSenderId(), previous.getKind(), state.getKind());
        }
    }

    public void remove(String senderId) {
        ConversationState removed = states.remove(senderId);
        if (removed != null) {
            log.debug("[{}] {} conversation closed at step {}", senderId, removed.getKind(), removed.stepName());
        }
    }

    public int size() {
        return states.size();
    }

    @Scheduled(fixedDelayString = "${assistant.dialogue.sweep-interval-ms:60000}")
    public void sweepIdle() {
        if (!properties.expiresIdleConversations()) return;
        Instant now = clock.instant();
        for (Map.Entry<String, ConversationState> entry : states.entrySet()) {
            ConversationState state = entry.getValue();
            // only the instance that was seen idle; a replacing put survives
            if (isExpired(state, now) && states.remove(entry.getKey(), state)) {
                log.info("[{}] Dropping idle {} conversation", entry.getKey(), state.getKind());
            }
        }
    }

    private boolean isExpired(ConversationState state, Instant now) {
        if (!properties.expiresIdleConversations()) return false;
        Duration idle = Duration.between(state.getLastActivity(), now);
        return idle.compareTo(properties.idleTimeout()) > 0;
    }
}
