package com.ai.assistant.seeder;

import com.ai.assistant.entity.Contact;
import com.ai.assistant.repository.ContactRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills an empty contact table from a JSON array of
 * {@code {name, email, phone, organization, address}} objects.
 */
@Component
public class ContactSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ContactSeeder.class);

    private final ContactRepository contactRepository;
    private final Resource source;
    private final ObjectMapper mapper = new ObjectMapper();

    public ContactSeeder(ContactRepository contactRepository,
                         @Value("${assistant.contacts.seed:classpath:contacts.json}") Resource source) {
        this.contactRepository = contactRepository;
        this.source = source;
    }

    @Override
    public void run(String... args) {
        if (contactRepository.count() > 0) {
            log.info("Contacts already seeded, skipping");
            return;
        }
        if (source == null || !source.exists()) {
            log.info("No contact seed file found, skipping");
            return;
        }
        try (InputStream in = source.getInputStream()) {
            List<Contact> contacts = parse(mapper.readTree(in));
            contactRepository.saveAll(contacts);
            log.info("Seeded {} contacts from {}", contacts.size(), source.getDescription());
        } catch (IOException e) {
            throw new IllegalStateException("Contact seed file is unreadable: " + source.getDescription(), e);
        }
    }

    private List<Contact> parse(JsonNode root) {
        List<Contact> contacts = new ArrayList<>();
        for (JsonNode node : root) {
            String name = node.path("name").asText("");
            if (StringUtils.isBlank(name)) continue;
            contacts.add(Contact.builder()
                    .name(name.trim())
                    .email(StringUtils.trimToNull(node.path("email").asText(null)))
                    .phone(StringUtils.trimToNull(node.path("phone").asText(null)))
                    .organization(StringUtils.trimToNull(node.path("organization").asText(null)))
                    .address(StringUtils.trimToNull(node.path("address").asText(null)))
                    .build());
        }
        return contacts;
    }
}
