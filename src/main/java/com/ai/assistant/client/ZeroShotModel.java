package com.ai.assistant.client;

import java.util.List;
import java.util.Map;

public interface ZeroShotModel {

    boolean isConfigured();

    /**
     * Scores {@code text} against each candidate label.
     *
     * @return label to score, empty when the model gave no answer
     * @throws CollaboratorException when the call fails
     */
    Map<String, Double> score(String text, List<String> labels, String hypothesisTemplate);
}
