package com.syncline.dispatch.api;

import com.syncline.core.dispatch.DispatchResult;
import com.syncline.core.dispatch.EventDispatcher;
import com.syncline.core.events.EventEnvelope;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts envelopes from the transport and runs them through the pipeline.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventIngestController {

    private final EventDispatcher dispatcher;

    public EventIngestController(EventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * POST /api/v1/events: Dispatch one envelope. Malformed envelopes answer 400.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody EventEnvelope envelope) {
        DispatchResult result = dispatcher.dispatch(envelope);
        if (result.outcome() == DispatchResult.Outcome.INVALID) {
            return ResponseEntity.badRequest().body(Map.of(
                    "outcome", result.outcome().name(),
                    "error", result.error()));
        }
        return ResponseEntity.ok(toMap(result));
    }

    /**
     * POST /api/v1/events/batch: Dispatch envelopes in order; one result per envelope.
     */
    @PostMapping("/batch")
    public ResponseEntity<Object> ingestBatch(@RequestBody List<EventEnvelope> envelopes) {
        if (envelopes == null || envelopes.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one envelope is required"));
        }
        List<Map<String, Object>> results = dispatcher.dispatchAll(envelopes).stream()
                .map(EventIngestController::toMap)
                .toList();
        return ResponseEntity.ok(Map.of("results", results));
    }

    private static Map<String, Object> toMap(DispatchResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("outcome", result.outcome().name());
        body.put("released", result.released());
        if (result.error() != null) {
            body.put("error", result.error());
        }
        return body;
    }
}
