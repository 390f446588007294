package com.ai.assistant.service.nlp;

import com.ai.assistant.client.NamedEntityRecognizer;
import com.ai.assistant.client.NamedEntityRecognizer.RecognizedEntity;
import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.utils.DateTimeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Local extraction: named entities, date/time/duration, addresses and intent-specific
 * fields, merged in that order. Each stage only overwrites the keys it found.
 */
@Component
@Order(2)
public class LocalEntityStrategy implements EntityStrategy {

    private static final Logger log = LoggerFactory.getLogger(LocalEntityStrategy.class);

    private final NamedEntityRecognizer recognizer;
    private final DateTimeParser dateTimeParser;

    public LocalEntityStrategy(NamedEntityRecognizer recognizer, DateTimeParser dateTimeParser) {
        this.recognizer = recognizer;
        this.dateTimeParser = dateTimeParser;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public Optional<EntityBag> tryExtract(String message, Intent intent) {
        EntityBag entities = namedEntities(message);
        entities.mergeFrom(dateTimeEntities(message));
        entities.mergeFrom(emailEntities(message));

        if (intent == Intent.SEND_EMAIL) {
            entities.mergeFrom(emailFields(message));
        } else if (intent == Intent.SCHEDULE_MEETING) {
            entities.mergeFrom(meetingFields(message));
        }

        if (!entities.has(EntityBag.Key.PERSON)) {
            if (intent == Intent.FIND_CONTACT) {
                SlotPatterns.nameAfterContactTrigger(message).ifPresent(entities::addPerson);
            } else if (intent == Intent.SCHEDULE_MEETING && !entities.has(EntityBag.Key.EMAIL)) {
                SlotPatterns.nameAfterWith(message).ifPresent(entities::addPerson);
            }
        }
        log.debug("Local entities for '{}': {}", message, entities);
        return Optional.of(entities);
    }

    private EntityBag namedEntities(String message) {
        EntityBag bag = EntityBag.empty();
        if (!recognizer.isConfigured()) return bag;
        try {
            List<RecognizedEntity> entities = recognizer.recognize(message);
            String organization = null;
            for (RecognizedEntity entity : entities) {
                if (entity.isPerson()) {
                    bag.addPerson(entity.text());
                } else if (entity.isLocation() && bag.getLocation() == null) {
                    bag.setLocation(entity.text());
                } else if (entity.isOrganization() && organization == null) {
                    organization = entity.text();
                }
            }
            if (bag.getLocation() == null) bag.setLocation(organization);
        } catch (RuntimeException e) {
            log.warn("Named-entity recognition failed, continuing without it: {}", e.getMessage());
        }
        return bag;
    }

    private EntityBag dateTimeEntities(String message) {
        EntityBag bag = EntityBag.empty();
        SlotPatterns.durationMinutes(message).ifPresent(bag::setDurationMinutes);

        dateTimeParser.parse(message).ifPresent(parsed -> {
            bag.setDate(parsed.date());
            // an explicit clock time in the text wins over the parser's own reading
            LocalTime time = DateTimeParser.firstExplicitTime(message)
                    .flatMap(dateTimeParser::parseTime)
                    .orElse(parsed.time());
            bag.setTime(time);
        });
        return bag;
    }

    private EntityBag emailEntities(String message) {
        EntityBag bag = EntityBag.empty();
        SlotPatterns.emails(message).forEach(bag::addEmail);
        return bag;
    }

    private EntityBag emailFields(String message) {
        EntityBag bag = EntityBag.empty();
        SlotPatterns.emailSubject(message).ifPresent(bag::setSubject);
        SlotPatterns.emailBody(message).ifPresent(bag::setBody);
        return bag;
    }

    private EntityBag meetingFields(String message) {
        EntityBag bag = EntityBag.empty();
        SlotPatterns.meetingLocation(message).ifPresent(bag::setLocation);
        SlotPatterns.meetingSubject(message).ifPresent(bag::setSubject);
        return bag;
    }
}
