package com.ai.assistant.service;

import com.ai.assistant.client.MessageTransport;
import com.ai.assistant.component.ConversationStore;
import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.conversation.ConversationState;
import com.ai.assistant.conversation.EmailConversation;
import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.conversation.MeetingConversation;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for one inbound chat message. An open conversation always gets the
 * message first; only when it does not handle it is a fresh intent classified.
 */
@Service
public class DialogueEngine {

    private static final Logger log = LoggerFactory.getLogger(DialogueEngine.class);

    private final ConversationStore store;
    private final ConversationLocks locks;
    private final IntentClassifier intentClassifier;
    private final EntityExtractor entityExtractor;
    private final EmailConversationFlow emailFlow;
    private final MeetingConversationFlow meetingFlow;
    private final InformationRequestService informationRequests;
    private final MessageTransport transport;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public DialogueEngine(ConversationStore store, ConversationLocks locks, IntentClassifier intentClassifier,
                          EntityExtractor entityExtractor, EmailConversationFlow emailFlow,
                          MeetingConversationFlow meetingFlow, InformationRequestService informationRequests,
                          MessageTransport transport, ResponsePhrases phrases, Clock clock) {
        this.store = store;
        this.locks = locks;
        this.intentClassifier = intentClassifier;
        this.entityExtractor = entityExtractor;
        this.emailFlow = emailFlow;
        this.meetingFlow = meetingFlow;
        this.informationRequests = informationRequests;
        this.transport = transport;
        this.phrases = phrases;
        this.clock = clock;
    }

    /**
     * Processes the message under the sender's lock and delivers the reply.
     * A message that cannot get the lock in time is dropped.
     */
    public void handle(String senderId, String text, Instant timestamp) {
        if (StringUtils.isBlank(senderId) || StringUtils.isBlank(text)) {
            log.debug("Ignoring empty message from '{}'", senderId);
            return;
        }
        boolean processed = locks.runExclusively(senderId, () -> {
            String reply = respond(senderId, text);
            if (StringUtils.isNotBlank(reply)) {
                log.info("[{}] AI | {}", senderId, reply);
                transport.deliver(senderId, reply);
            }
        });
        if (!processed) {
            log.error("[{}] Message sent at {} dropped: '{}'", senderId, timestamp, text);
        }
    }

    /** Computes the reply without delivering it. Callers must hold the sender's lock. */
    String respond(String senderId, String text) {
        String message = text.trim();
        log.info("[{}] USER | {}", senderId, message);
        try {
            Optional<String> continued = continueConversation(senderId, message);
            if (continued.isPresent()) return continued.get();
            return startNew(senderId, message);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to process message '{}'", senderId, message, e);
            store.remove(senderId);
            return phrases.genericError();
        }
    }

    private Optional<String> continueConversation(String senderId, String message) {
        Optional<ConversationState> open = store.get(senderId);
        if (open.isEmpty()) return Optional.empty();

        ConversationState state = open.get();
        state.touch(clock.instant());
        log.info("[{}] continuing {} conversation at {}", senderId, state.getKind(), state.stepName());
        switch (state.getKind()) {
            case EMAIL:
                return emailFlow.proceed((EmailConversation) state, message);
            case MEETING:
                return meetingFlow.proceed((MeetingConversation) state, message);
            default:
                return Optional.empty();
        }
    }

    private String startNew(String senderId, String message) {
        IntentResult intent = intentClassifier.classify(message);
        EntityBag entities = entityExtractor.extract(message, intent.getIntent());
        log.info("[{}] intent={} ({}) entities={}", senderId, intent.getIntent().code(),
                String.format("%.2f", intent.getConfidence()), entities);

        switch (intent.getIntent()) {
            case SEND_EMAIL:
                return emailFlow.start(senderId, entities);
            case SCHEDULE_MEETING:
                return meetingFlow.start(senderId, entities);
            case CHECK_CALENDAR:
                return informationRequests.checkCalendar(message, entities);
            case FIND_CONTACT:
                return informationRequests.findContact(message, entities);
            case CHECK_FREE_SLOTS:
                return informationRequests.checkFreeSlots(entities);
            default:
                return phrases.capabilities();
        }
    }
}
