package com.ai.assistant.client;

import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenRouterLanguageProviderTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private OpenRouterLanguageProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new OpenRouterLanguageProvider(restTemplate, "key-123", "test/model", URL);
    }

    @Test
    void classifiesIntentFromFencedAnswer() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-123"))
                .andExpect(jsonPath("$.model").value("test/model"))
                .andRespond(withSuccess(completion("```json\\n{\\\"intent\\\": \\\"schedule_meeting\\\", \\\"confidence\\\": 0.93}\\n```"),
                        MediaType.APPLICATION_JSON));

        Optional<IntentResult> result = provider.classifyIntent("set up a call with Jane");

        assertTrue(result.isPresent());
        assertEquals(Intent.SCHEDULE_MEETING, result.get().getIntent());
        assertEquals(0.93, result.get().getConfidence(), 1e-9);
        server.verify();
    }

    @Test
    void mapsEntityAnswerIntoBag() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(completion("{\\\"person\\\": [\\\"Jane Doe\\\"], \\\"date\\\": \\\"2025-03-14\\\", "
                        + "\\\"time\\\": \\\"15:00\\\", \\\"duration\\\": \\\"45\\\", \\\"location\\\": \\\"Room 4\\\"}"),
                        MediaType.APPLICATION_JSON));

        EntityBag bag = provider.extractEntities("meet Jane friday 3pm for 45 minutes in Room 4", Intent.SCHEDULE_MEETING)
                .orElseThrow();

        assertEquals(List.of("Jane Doe"), bag.getPersons());
        assertEquals("2025-03-14", bag.getDateText());
        assertEquals("15:00", bag.getTimeText());
        assertEquals(45, bag.getDurationMinutes());
        assertEquals("Room 4", bag.getLocation());
        assertFalse(bag.has(EntityBag.Key.EMAIL));
    }

    @Test
    void serverErrorDegradesToEmpty() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertTrue(provider.classifyIntent("hello").isEmpty());
    }

    @Test
    void proseWithoutJsonIsIgnored() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(completion("I think this is about email."), MediaType.APPLICATION_JSON));

        assertTrue(provider.classifyIntent("hello").isEmpty());
    }

    @Test
    void missingKeyMeansNotConfigured() {
        OpenRouterLanguageProvider unconfigured = new OpenRouterLanguageProvider(new RestTemplate(), "", "m", URL);

        assertFalse(unconfigured.isConfigured());
        assertTrue(unconfigured.classifyIntent("hello").isEmpty());
    }

    private static String completion(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"}}]}";
    }
}
