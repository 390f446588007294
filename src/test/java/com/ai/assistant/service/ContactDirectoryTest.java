package com.ai.assistant.service;

import com.ai.assistant.client.CollaboratorException;
import com.ai.assistant.client.ContactSource;
import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContactDirectoryTest {

    private static final ContactRef JANE = new ContactRef("Jane Doe", "jane@example.com", null, null, null);

    @Mock
    private ContactSource primary;

    @Mock
    private ContactSource secondary;

    private ContactDirectory directory;

    @BeforeEach
    void setUp() {
        when(primary.name()).thenReturn("google");
        when(secondary.name()).thenReturn("local");
        directory = new ContactDirectory(List.of(primary, secondary));
    }

    @Test
    void primaryHitWins() {
        when(primary.findByName("Jane")).thenReturn(ContactLookup.found(JANE));

        assertEquals(Optional.of("jane@example.com"), directory.findEmail("Jane"));
        verify(secondary, never()).findByName(any());
    }

    @Test
    void errorAndMissesFallThroughToSecondary() {
        when(primary.findByName("Jane")).thenReturn(ContactLookup.error("401 Unauthorized"));
        when(secondary.findByName("Jane")).thenReturn(ContactLookup.found(JANE));

        assertEquals(JANE, directory.findWithEmail("Jane").orElseThrow());
    }

    @Test
    void hitWithoutEmailDoesNotCount() {
        when(primary.findByName("Carlos")).thenReturn(ContactLookup.found(new ContactRef("Carlos", null, "+351", null, null)));
        when(secondary.findByName("Carlos")).thenReturn(ContactLookup.notFound());

        assertTrue(directory.findEmail("Carlos").isEmpty());
    }

    @Test
    void searchUsesFirstNonEmptySourceAndSwallowsErrors() {
        when(primary.search("jane")).thenThrow(new CollaboratorException("down"));
        when(secondary.search("jane")).thenReturn(List.of(JANE));

        assertEquals(List.of(JANE), directory.search("jane"));
    }

    @Test
    void blankQueries() {
        assertTrue(directory.findEmail(" ").isEmpty());
        assertTrue(directory.search("").isEmpty());
    }
}
