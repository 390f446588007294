package com.ai.assistant.client;

import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;

import java.util.List;

/**
 * One place contacts can be looked up in. Sources are tried in {@code @Order}.
 */
public interface ContactSource {

    String name();

    /** Never throws; failures come back as {@link ContactLookup.Status#ERROR}. */
    ContactLookup findByName(String name);

    /**
     * @throws CollaboratorException when the source cannot be queried
     */
    List<ContactRef> search(String query);
}
