package com.ai.assistant.client;

import java.util.List;

public interface NamedEntityRecognizer {

    boolean isConfigured();

    /**
     * Entities in order of appearance.
     *
     * @throws CollaboratorException when the call fails
     */
    List<RecognizedEntity> recognize(String text);

    record RecognizedEntity(String label, String text) {

        public boolean isPerson() {
            return "PER".equalsIgnoreCase(label) || "PERSON".equalsIgnoreCase(label);
        }

        public boolean isLocation() {
            return "LOC".equalsIgnoreCase(label) || "GPE".equalsIgnoreCase(label);
        }

        public boolean isOrganization() {
            return "ORG".equalsIgnoreCase(label);
        }
    }
}
