package com.ai.assistant.service;

import com.ai.assistant.client.ContactSource;
import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Contact lookups across the ordered contact sources.
 */
@Service
public class ContactDirectory {

    private static final Logger log = LoggerFactory.getLogger(ContactDirectory.class);

    private final List<ContactSource> sources;

    public ContactDirectory(List<ContactSource> sources) {
        this.sources = List.copyOf(sources);
    }

    /** First contact with an email address, trying each source in order. */
    public Optional<ContactRef> findWithEmail(String name) {
        if (StringUtils.isBlank(name)) return Optional.empty();
        for (ContactSource source : sources) {
            ContactLookup lookup = source.findByName(name);
            switch (lookup.status()) {
                case FOUND:
                    if (lookup.isFoundWithEmail()) {
                        log.info("Contact '{}' resolved via {}", name, source.name());
                        return Optional.of(lookup.contact());
                    }
                    log.debug("Contact '{}' found via {} without an email", name, source.name());
                    break;
                case ERROR:
                    log.warn("Contact source {} failed for '{}': {}", source.name(), name, lookup.error());
                    break;
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    public Optional<String> findEmail(String name) {
        return findWithEmail(name).map(ContactRef::email);
    }

    /** Hits of the first source that has any. A failing source counts as empty. */
    public List<ContactRef> search(String query) {
        if (StringUtils.isBlank(query)) return List.of();
        for (ContactSource source : sources) {
            try {
                List<ContactRef> hits = source.search(query);
                if (!hits.isEmpty()) return hits;
            } catch (RuntimeException e) {
                log.warn("Contact search in {} failed for '{}': {}", source.name(), query, e.getMessage());
            }
        }
        return List.of();
    }
}
