package com.ai.assistant.service.nlp;

import com.ai.assistant.client.LanguageProvider;
import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.utils.DateTimeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Entities from the remote language model. Its bag is returned as is apart from
 * date and time text, which is normalized when it can be read.
 */
@Component
@Order(1)
public class RemoteEntityStrategy implements EntityStrategy {

    private static final Logger log = LoggerFactory.getLogger(RemoteEntityStrategy.class);
    private static final DateTimeFormatter STRICT_TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final LanguageProvider languageProvider;
    private final DateTimeParser dateTimeParser;

    public RemoteEntityStrategy(LanguageProvider languageProvider, DateTimeParser dateTimeParser) {
        this.languageProvider = languageProvider;
        this.dateTimeParser = dateTimeParser;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public Optional<EntityBag> tryExtract(String message, Intent intent) {
        if (!languageProvider.isConfigured()) return Optional.empty();
        Optional<EntityBag> answer = languageProvider.extractEntities(message, intent);
        if (answer.isEmpty() || answer.get().isEmpty()) return Optional.empty();

        EntityBag bag = answer.get();
        normalizeDate(bag);
        normalizeTime(bag);
        return Optional.of(bag);
    }

    private void normalizeDate(EntityBag bag) {
        String text = bag.getDateText();
        if (text == null) return;
        try {
            bag.setDate(LocalDate.parse(text.trim()));
            return;
        } catch (DateTimeParseException e) {
            log.debug("Remote date '{}' is not ISO, trying natural language", text);
        }
        dateTimeParser.parseDate(text).ifPresent(bag::setDate);
    }

    private void normalizeTime(EntityBag bag) {
        String text = bag.getTimeText();
        if (text == null) return;
        try {
            bag.setTime(LocalTime.parse(text.trim(), STRICT_TIME));
            return;
        } catch (DateTimeParseException e) {
            log.debug("Remote time '{}' is not HH:mm, trying natural language", text);
        }
        dateTimeParser.parseTime(text).ifPresent(bag::setTime);
    }
}
