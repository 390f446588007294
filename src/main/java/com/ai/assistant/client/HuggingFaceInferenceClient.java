package com.ai.assistant.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-shot classification and named-entity recognition through the Hugging Face
 * inference API. Both models share the same token.
 */
@Service
public class HuggingFaceInferenceClient implements ZeroShotModel, NamedEntityRecognizer {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceInferenceClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiToken;
    private final String baseUrl;
    private final String zeroShotModel;
    private final String nerModel;

    public HuggingFaceInferenceClient(
            RestTemplate restTemplate,
            @Value("${huggingface.api-token:}") String apiToken,
            @Value("${huggingface.base-url:https://api-inference.huggingface.co/models}") String baseUrl,
            @Value("${huggingface.zero-shot-model:facebook/bart-large-mnli}") String zeroShotModel,
            @Value("${huggingface.ner-model:dslim/bert-base-NER}") String nerModel) {
        this.restTemplate = restTemplate;
        this.apiToken = apiToken;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.zeroShotModel = zeroShotModel;
        this.nerModel = nerModel;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.isNotBlank(apiToken);
    }

    @Override
    public Map<String, Double> score(String text, List<String> labels, String hypothesisTemplate) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("candidate_labels", labels);
        parameters.put("hypothesis_template", hypothesisTemplate);
        parameters.put("multi_label", false);

        JsonNode root = post(zeroShotModel, text, parameters);
        // a single input may come back wrapped in an array
        if (root.isArray()) root = root.path(0);

        JsonNode outLabels = root.path("labels");
        JsonNode outScores = root.path("scores");
        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < outLabels.size() && i < outScores.size(); i++) {
            scores.put(outLabels.get(i).asText(), outScores.get(i).asDouble());
        }
        return scores;
    }

    @Override
    public List<RecognizedEntity> recognize(String text) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("aggregation_strategy", "simple");

        JsonNode root = post(nerModel, text, parameters);
        List<RecognizedEntity> entities = new ArrayList<>();
        if (!root.isArray()) return entities;
        for (JsonNode node : root) {
            String label = node.path("entity_group").asText(node.path("entity").asText(""));
            String word = node.path("word").asText("");
            if (StringUtils.isNoneBlank(label, word)) {
                entities.add(new RecognizedEntity(StringUtils.removeStart(label, "B-"), word.trim()));
            }
        }
        return entities;
    }

    private JsonNode post(String model, String text, Map<String, Object> parameters) {
        if (!isConfigured()) {
            throw new CollaboratorException("Hugging Face token is not set");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("inputs", text);
        body.put("parameters", parameters);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/" + model, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new CollaboratorException("Inference API returned " + response.getStatusCode() + " for " + model);
            }
            return mapper.readTree(response.getBody());
        } catch (RestClientException e) {
            throw new CollaboratorException("Inference API call failed for " + model, e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("Inference API answer unreadable for " + model, e);
        }
    }
}
