package com.syncline.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.core.dispatch.DispatchResult;
import com.syncline.core.dispatch.EventDispatcher;
import com.syncline.core.events.EventEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventIngestController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EventIngestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private EventDispatcher dispatcher;

    private String envelopeJson(long sequence) throws Exception {
        return objectMapper.writeValueAsString(new EventEnvelope("message.updated",
                Map.of("info", Map.of("id", "msg-1")), "evt-" + sequence, sequence,
                1_700_000_000_000L, "ses_01", null));
    }

    // ── POST /api/v1/events ──────────────────────────────────────────

    @Test
    @DisplayName("POST /events returns the outcome and released count")
    void ingestApplied() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn(DispatchResult.applied(3));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(envelopeJson(2)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("APPLIED"))
                .andExpect(jsonPath("$.released").value(3))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("POST /events reports queued envelopes with 200")
    void ingestQueued() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn(DispatchResult.queued());

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(envelopeJson(5)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("QUEUED"))
                .andExpect(jsonPath("$.released").value(0));
    }

    @Test
    @DisplayName("POST /events returns 400 for a malformed envelope")
    void ingestInvalid() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn(DispatchResult.invalid("eventId is required"));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"message.updated\",\"properties\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.outcome").value("INVALID"))
                .andExpect(jsonPath("$.error").value("eventId is required"));
    }

    @Test
    @DisplayName("POST /events accepts sessionID as the stream id")
    void ingestAcceptsSessionIdAlias() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn(DispatchResult.applied(1));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"session.status\",\"properties\":{},\"eventId\":\"e1\","
                                + "\"sequence\":1,\"timestamp\":5,\"sessionID\":\"ses_01\"}"))
                .andExpect(status().isOk());

        verify(dispatcher).dispatch(new EventEnvelope("session.status", Map.of(), "e1", 1L, 5L, "ses_01", null));
    }

    // ── POST /api/v1/events/batch ────────────────────────────────────

    @Test
    @DisplayName("POST /events/batch returns one result per envelope")
    void ingestBatch() throws Exception {
        when(dispatcher.dispatchAll(anyList())).thenReturn(List.of(
                DispatchResult.queued(), DispatchResult.applied(2)));

        String body = "[" + envelopeJson(3) + "," + envelopeJson(2) + "]";
        mockMvc.perform(post("/api/v1/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[0].outcome").value("QUEUED"))
                .andExpect(jsonPath("$.results[1].released").value(2));
    }

    @Test
    @DisplayName("POST /events/batch rejects an empty batch")
    void ingestEmptyBatch() throws Exception {
        mockMvc.perform(post("/api/v1/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one envelope is required"));

        verify(dispatcher, never()).dispatchAll(anyList());
    }
}
