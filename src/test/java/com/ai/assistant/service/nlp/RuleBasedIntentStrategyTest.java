package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RuleBasedIntentStrategyTest {

    private final RuleBasedIntentStrategy strategy = new RuleBasedIntentStrategy();

    @Test
    void patternGroupsWinWithHighConfidence() {
        assertResult("send an email to bob", Intent.SEND_EMAIL, RuleBasedIntentStrategy.PATTERN_CONFIDENCE);
        assertResult("please set up a meeting", Intent.SCHEDULE_MEETING, RuleBasedIntentStrategy.PATTERN_CONFIDENCE);
        assertResult("who is Jane Doe", Intent.FIND_CONTACT, RuleBasedIntentStrategy.PATTERN_CONFIDENCE);
        assertResult("when am I free tomorrow", Intent.CHECK_FREE_SLOTS, RuleBasedIntentStrategy.PATTERN_CONFIDENCE);
    }

    @Test
    void calendarGroupIsCheckedFirst() {
        // matches both the calendar and the meeting vocabulary
        assertResult("any meetings today", Intent.CHECK_CALENDAR, RuleBasedIntentStrategy.PATTERN_CONFIDENCE);
    }

    @Test
    void looseKeywordsScoreLower() {
        assertResult("need to schedule something", Intent.SCHEDULE_MEETING, RuleBasedIntentStrategy.KEYWORD_CONFIDENCE);
        assertResult("anything on the agenda", Intent.CHECK_CALENDAR, RuleBasedIntentStrategy.KEYWORD_CONFIDENCE);
    }

    @Test
    void unknownAsFloor() {
        assertResult("good morning", Intent.UNKNOWN, RuleBasedIntentStrategy.UNKNOWN_CONFIDENCE);
        assertResult("   ", Intent.UNKNOWN, 0.0);
    }

    @Test
    void sameInputSameAnswer() {
        String message = "Could you write an email for me";
        IntentResult first = strategy.tryClassify(message).orElseThrow();
        IntentResult second = strategy.tryClassify(message).orElseThrow();

        assertEquals(first.getIntent(), second.getIntent());
        assertEquals(first.getConfidence(), second.getConfidence());
    }

    private void assertResult(String message, Intent intent, double confidence) {
        IntentResult result = strategy.tryClassify(message).orElseThrow();
        assertEquals(intent, result.getIntent(), message);
        assertEquals(confidence, result.getConfidence(), 1e-9, message);
    }
}
