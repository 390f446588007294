package com.ai.assistant.service;

import com.ai.assistant.client.EmailSender;
import com.ai.assistant.component.ConversationStore;
import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.conversation.EmailConversation;
import com.ai.assistant.conversation.EmailValidationResult;
import com.ai.assistant.conversation.EntityBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Slot-filling for {@code send_email}: recipient, subject, body, confirmation.
 */
@Service
public class EmailConversationFlow {

    private static final Logger log = LoggerFactory.getLogger(EmailConversationFlow.class);

    private final ConversationStore store;
    private final ContactDirectory contacts;
    private final EmailSender emailSender;
    private final EmailAddressValidator addressValidator;
    private final YesNoClassifier yesNo;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public EmailConversationFlow(ConversationStore store, ContactDirectory contacts, EmailSender emailSender,
                                 EmailAddressValidator addressValidator, YesNoClassifier yesNo,
                                 ResponsePhrases phrases, Clock clock) {
        this.store = store;
        this.contacts = contacts;
        this.emailSender = emailSender;
        this.addressValidator = addressValidator;
        this.yesNo = yesNo;
        this.phrases = phrases;
        this.clock = clock;
    }

    /**
     * Sends right away when recipient, subject and body are all known and the recipient
     * resolves to an address; otherwise opens a conversation at the first missing slot.
     */
    public String start(String senderId, EntityBag entities) {
        String address = entities.firstEmail();
        String person = entities.firstPerson();
        String subject = entities.getSubject();
        String body = entities.getBody();

        String resolved = address != null ? address : (person != null ? contacts.findEmail(person).orElse(null) : null);
        if (resolved != null && subject != null && body != null) {
            log.info("[{}] email complete in one message, sending to {}", senderId, resolved);
            return send(resolved, subject, body);
        }

        EmailConversation state = new EmailConversation(senderId, clock.instant());
        state.setRecipient(resolved != null ? resolved : person);
        state.setSubject(subject);
        state.setBody(body);
        state.setStep(state.nextMissingStep());
        store.put(state);
        log.info("[{}] email flow opened at {}", senderId, state.getStep());
        return promptFor(state);
    }

    public Optional<String> proceed(EmailConversation state, String text) {
        switch (state.getStep()) {
            case RECIPIENT:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                if (text.contains("@")) {
                    EmailValidationResult validation = addressValidator.validate(text);
                    if (!validation.valid()) {
                        return Optional.of(phrases.invalidAddress(text, validation.errorMessage(), validation.suggestedCorrection()));
                    }
                }
                state.setRecipient(text);
                return Optional.of(advance(state));
            case SUBJECT:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                state.setSubject(text);
                return Optional.of(advance(state));
            case BODY:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                state.setBody(text);
                return Optional.of(advance(state));
            case CONFIRM:
                return Optional.of(confirm(state, text));
            default:
                return Optional.empty();
        }
    }

    private String confirm(EmailConversation state, String text) {
        if (!yesNo.isAffirmative(text, YesNoClassifier.EMAIL_CONFIRM)) {
            return cancel(state);
        }
        String recipient = state.getRecipient();
        if (!recipient.contains("@")) {
            Optional<String> email = contacts.findEmail(recipient);
            if (email.isEmpty()) {
                log.info("[{}] recipient '{}' unresolved, back to RECIPIENT", state.getSenderId(), recipient);
                state.setStep(EmailConversation.Step.RECIPIENT);
                return phrases.recipientNotFound(recipient);
            }
            recipient = email.get();
        }
        store.remove(state.getSenderId());
        return send(recipient, state.getSubject(), state.getBody());
    }

    private String send(String to, String subject, String body) {
        EmailSender.SendResult result = emailSender.send(to, subject, body);
        if (result.success()) return phrases.emailSent(to);
        log.warn("Email to {} not sent: {}", to, result.error());
        return phrases.emailFailed();
    }

    private String advance(EmailConversation state) {
        EmailConversation.Step from = state.getStep();
        state.setStep(state.nextMissingStep());
        log.info("[{}] email step={} -> {}", state.getSenderId(), from, state.getStep());
        return promptFor(state);
    }

    private String promptFor(EmailConversation state) {
        switch (state.getStep()) {
            case RECIPIENT:
                return phrases.askEmailRecipient();
            case SUBJECT:
                return phrases.askEmailSubject(state.getRecipient());
            case BODY:
                return phrases.askEmailBody(state.getRecipient());
            default:
                return phrases.confirmEmail(state.getRecipient(), state.getSubject(), state.getBody());
        }
    }

    private String cancel(EmailConversation state) {
        store.remove(state.getSenderId());
        log.info("[{}] email flow canceled at {}", state.getSenderId(), state.getStep());
        return phrases.emailCanceled();
    }
}
