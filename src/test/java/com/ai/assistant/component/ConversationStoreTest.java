package com.ai.assistant.component;

import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.EmailConversation;
import com.ai.assistant.conversation.MeetingConversation;
import com.ai.assistant.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStoreTest {

    private MutableClock clock;
    private ConversationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-10T10:00:00Z"), ZoneOffset.UTC);
        store = new ConversationStore(clock, DialogueProperties.defaults());
    }

    @Test
    void oneConversationPerSender() {
        EmailConversation email = new EmailConversation("alice", clock.instant());
        MeetingConversation meeting = new MeetingConversation("alice", clock.instant());

        store.put(email);
        store.put(meeting);

        assertSame(meeting, store.get("alice").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void sendersAreIndependent() {
        store.put(new EmailConversation("alice", clock.instant()));
        store.put(new EmailConversation("bob", clock.instant()));

        store.remove("alice");

        assertFalse(store.has("alice"));
        assertTrue(store.has("bob"));
    }

    @Test
    void idleStateReadsAsAbsent() {
        store.put(new EmailConversation("alice", clock.instant()));

        clock.advance(Duration.ofMinutes(29));
        assertTrue(store.has("alice"));

        clock.advance(Duration.ofMinutes(2));
        assertFalse(store.has("alice"));
        assertEquals(0, store.size());
    }

    @Test
    void touchingKeepsStateAlive() {
        EmailConversation email = new EmailConversation("alice", clock.instant());
        store.put(email);

        clock.advance(Duration.ofMinutes(20));
        email.touch(clock.instant());
        clock.advance(Duration.ofMinutes(20));

        assertTrue(store.has("alice"));
    }

    @Test
    void sweepKeepsStateTouchedBeforeIt() {
        EmailConversation email = new EmailConversation("alice", clock.instant());
        store.put(email);
        clock.advance(Duration.ofMinutes(31));

        email.touch(clock.instant());
        store.sweepIdle();

        assertSame(email, store.get("alice").orElseThrow());
    }

    @Test
    void sweepDropsOnlyIdleStates() {
        store.put(new EmailConversation("alice", clock.instant()));
        clock.advance(Duration.ofMinutes(25));
        store.put(new MeetingConversation("bob", clock.instant()));
        clock.advance(Duration.ofMinutes(10));

        store.sweepIdle();

        assertEquals(1, store.size());
        assertTrue(store.has("bob"));
    }

    @Test
    void zeroTimeoutDisablesExpiry() {
        DialogueProperties noExpiry = new DialogueProperties(null, Duration.ZERO, null, null, null, null, null, null, null, null);
        ConversationStore keeping = new ConversationStore(clock, noExpiry);
        keeping.put(new EmailConversation("alice", clock.instant()));

        clock.advance(Duration.ofDays(3));
        keeping.sweepIdle();

        assertTrue(keeping.has("alice"));
    }
}
