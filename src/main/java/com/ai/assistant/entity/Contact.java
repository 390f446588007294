package com.ai.assistant.entity;

import com.ai.assistant.conversation.ContactRef;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "contact")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 150)
    private String name;

    @Column(length = 254)
    private String email;

    @Column(length = 40)
    private String phone;

    @Column(length = 150)
    private String organization;

    @Column(length = 255)
    private String address;

    public ContactRef toRef() {
        return new ContactRef(name, email, phone, organization, address);
    }
}
