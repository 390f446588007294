package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuickKeywordIntentStrategyTest {

    private final QuickKeywordIntentStrategy strategy = new QuickKeywordIntentStrategy();

    @Test
    void bareEmailKeyword() {
        IntentResult result = strategy.tryClassify("email").orElseThrow();

        assertEquals(Intent.SEND_EMAIL, result.getIntent());
        assertEquals(0.9, result.getConfidence(), 1e-9);
    }

    @Test
    void calendarPhrasesScoreHigherThanKeywords() {
        IntentResult result = strategy.tryClassify("What's on my calendar today?").orElseThrow();

        assertEquals(Intent.CHECK_CALENDAR, result.getIntent());
        assertEquals(0.95, result.getConfidence(), 1e-9);
    }

    @Test
    void keywordsMapToTheirIntents() {
        assertEquals(Intent.SCHEDULE_MEETING, strategy.tryClassify("book a meeting with Ana").orElseThrow().getIntent());
        assertEquals(Intent.FIND_CONTACT, strategy.tryClassify("contact for Jane").orElseThrow().getIntent());
        assertEquals(Intent.CHECK_FREE_SLOTS, strategy.tryClassify("do I have free time friday").orElseThrow().getIntent());
        assertEquals(Intent.CHECK_FREE_SLOTS, strategy.tryClassify("my availability").orElseThrow().getIntent());
    }

    @Test
    void declinesAnythingElse() {
        assertTrue(strategy.tryClassify("hello there").isEmpty());
    }
}
