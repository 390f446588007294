package com.ai.assistant.client;

import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Language provider backed by an OpenAI-compatible chat completions endpoint
 * (OpenRouter by default). Every failure degrades to {@link Optional#empty()}.
 */
@Service
public class OpenRouterLanguageProvider implements LanguageProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterLanguageProvider.class);

    private static final String INTENT_PROMPT =
            "You classify messages sent to a personal assistant. Allowed intents: "
                    + "send_email, schedule_meeting, check_calendar, find_contact, check_free_slots, unknown. "
                    + "Answer with JSON only: {\"intent\": \"<intent>\", \"confidence\": <0..1>}";

    private static final String ENTITY_PROMPT =
            "Extract entities from a message sent to a personal assistant. Answer with JSON only, "
                    + "omitting keys you cannot find: {\"person\": [names], \"date\": \"YYYY-MM-DD\", "
                    + "\"time\": \"HH:MM\", \"duration\": <minutes>, \"email\": [addresses], "
                    + "\"subject\": \"...\", \"body\": \"...\", \"location\": \"...\"}";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String url;

    public OpenRouterLanguageProvider(
            RestTemplate restTemplate,
            @Value("${openrouter.api-key:}") String apiKey,
            @Value("${openrouter.model:openai/gpt-4o-mini}") String model,
            @Value("${openrouter.url:https://openrouter.ai/api/v1/chat/completions}") String url) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.model = model;
        this.url = url;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.isNotBlank(apiKey);
    }

    @Override
    public Optional<IntentResult> classifyIntent(String message) {
        if (!isConfigured()) return Optional.empty();
        return complete(INTENT_PROMPT, message).flatMap(node -> {
            String code = node.path("intent").asText("");
            if (StringUtils.isBlank(code)) return Optional.empty();
            double confidence = node.path("confidence").asDouble(0.8);
            return Optional.of(IntentResult.of(Intent.fromCode(code), confidence));
        });
    }

    @Override
    public Optional<EntityBag> extractEntities(String message, Intent intent) {
        if (!isConfigured()) return Optional.empty();
        String user = intent != null ? "Intent: " + intent.code() + "\nMessage: " + message : message;
        return complete(ENTITY_PROMPT, user).map(this::toEntityBag);
    }

    private EntityBag toEntityBag(JsonNode node) {
        EntityBag bag = EntityBag.empty();
        for (String person : textValues(node.path("person"))) bag.addPerson(person);
        for (String email : textValues(node.path("email"))) bag.addEmail(email);
        bag.setDateText(textOrNull(node.path("date")));
        bag.setTimeText(textOrNull(node.path("time")));
        JsonNode duration = node.path("duration");
        if (duration.canConvertToInt()) {
            bag.setDurationMinutes(duration.asInt());
        } else if (duration.isTextual() && StringUtils.isNumeric(duration.asText())) {
            bag.setDurationMinutes(Integer.parseInt(duration.asText()));
        }
        bag.setSubject(textOrNull(node.path("subject")));
        bag.setBody(textOrNull(node.path("body")));
        bag.setLocation(textOrNull(node.path("location")));
        return bag;
    }

    private Optional<JsonNode> complete(String systemPrompt, String userMessage) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt);
        messages.add(systemMsg);
        Map<String, String> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", userMessage);
        messages.add(userMsg);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", 0);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.warn("Language provider returned {}", response.getStatusCode());
                return Optional.empty();
            }
            String content = mapper.readTree(response.getBody())
                    .path("choices").path(0).path("message").path("content").asText("");
            return parseJsonContent(content);
        } catch (RestClientException e) {
            log.warn("Language provider call failed: {}", e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Language provider answer could not be read", e);
            return Optional.empty();
        }
    }

    /** Models sometimes wrap the JSON in a markdown fence or add prose around it. */
    private Optional<JsonNode> parseJsonContent(String content) throws Exception {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        JsonNode node = mapper.readTree(content.substring(start, end + 1));
        return node.isObject() ? Optional.of(node) : Optional.empty();
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> {
                if (n.isTextual()) values.add(n.asText());
            });
        } else if (node.isTextual()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return null;
        return node.isValueNode() ? node.asText() : null;
    }
}
