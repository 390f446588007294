package com.ai.assistant.client;

import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;
import com.ai.assistant.entity.Contact;
import com.ai.assistant.repository.ContactRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Contacts kept in the local database; secondary to the remote address book.
 */
@Service
@Order(2)
public class LocalContactSource implements ContactSource {

    private final ContactRepository contactRepository;

    public LocalContactSource(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public ContactLookup findByName(String name) {
        if (StringUtils.isBlank(name)) return ContactLookup.notFound();
        try {
            Optional<Contact> exact = contactRepository.findFirstByNameIgnoreCase(name.trim());
            if (exact.isPresent()) return ContactLookup.found(exact.get().toRef());
            List<Contact> partial = contactRepository.findByNameContainingIgnoreCaseOrderByNameAsc(name.trim());
            return partial.isEmpty() ? ContactLookup.notFound() : ContactLookup.found(partial.get(0).toRef());
        } catch (DataAccessException e) {
            return ContactLookup.error(e.getMessage());
        }
    }

    @Override
    public List<ContactRef> search(String query) {
        if (StringUtils.isBlank(query)) return List.of();
        try {
            return contactRepository.findByNameContainingIgnoreCaseOrderByNameAsc(query.trim()).stream()
                    .map(Contact::toRef)
                    .toList();
        } catch (DataAccessException e) {
            throw new CollaboratorException("Local contact search failed", e);
        }
    }
}
