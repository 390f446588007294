package com.ai.assistant.controller;

import com.ai.assistant.service.InboundMessageDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WhatsAppWebhookControllerTest {

    @Mock
    private InboundMessageDispatcher dispatcher;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WhatsAppWebhookController(dispatcher, "s3cret")).build();
    }

    @Test
    void echoesChallengeForMatchingToken() throws Exception {
        mockMvc.perform(get("/webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "s3cret")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isOk())
                .andExpect(content().string("1158201444"));
    }

    @Test
    void rejectsWrongToken() throws Exception {
        mockMvc.perform(get("/webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "guess")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isForbidden());
    }

    @Test
    void dispatchesTextMessages() throws Exception {
        String payload = "{\"object\":\"whatsapp_business_account\",\"entry\":[{\"changes\":[{\"value\":{"
                + "\"messages\":[{\"from\":\"15550001111\",\"timestamp\":\"1741600800\",\"type\":\"text\","
                + "\"text\":{\"body\":\"what's on my calendar today\"}},"
                + "{\"from\":\"15550001111\",\"timestamp\":\"1741600801\",\"type\":\"image\",\"image\":{\"id\":\"42\"}}]"
                + "}}]}]}";

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));

        verify(dispatcher).submit("15550001111", "what's on my calendar today", Instant.ofEpochSecond(1741600800L));
        verify(dispatcher, times(1)).submit(anyString(), anyString(), any());
    }

    @Test
    void statusNotificationsAreAcknowledged() throws Exception {
        String payload = "{\"entry\":[{\"changes\":[{\"value\":{\"statuses\":[{\"id\":\"wamid.1\",\"status\":\"read\"}]}}]}]}";

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isOk());

        verifyNoInteractions(dispatcher);
    }
}
