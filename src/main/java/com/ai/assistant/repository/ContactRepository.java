package com.ai.assistant.repository;

import com.ai.assistant.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ContactRepository extends JpaRepository<Contact, Long> {

    Optional<Contact> findFirstByNameIgnoreCase(String name);

    List<Contact> findByNameContainingIgnoreCaseOrderByNameAsc(String fragment);
}
