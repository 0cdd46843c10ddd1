package com.syncline.dispatch.api;

import com.syncline.core.dispatch.EventDispatcher;
import com.syncline.core.model.Message;
import com.syncline.core.optimistic.OptimisticWriter;
import com.syncline.core.store.Projection;
import com.syncline.core.store.StreamSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for reading and manipulating one stream of the projection.
 */
@RestController
@RequestMapping("/api/v1/streams")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final Projection projection;
    private final EventDispatcher dispatcher;
    private final OptimisticWriter optimisticWriter;

    public StreamController(Projection projection, EventDispatcher dispatcher, OptimisticWriter optimisticWriter) {
        this.projection = projection;
        this.dispatcher = dispatcher;
        this.optimisticWriter = optimisticWriter;
    }

    /**
     * GET /api/v1/streams/{streamId}: Session, status, messages with parts, ordering stats.
     */
    @GetMapping("/{streamId}")
    public ResponseEntity<Map<String, Object>> getStream(@PathVariable String streamId) {
        StreamSnapshot snapshot = projection.snapshot(streamId);
        if (!snapshot.exists()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Stream not found: " + streamId));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session", snapshot.session());
        body.put("status", snapshot.status());
        body.put("messages", snapshot.messages());
        body.put("ordering", dispatcher.orderingStats(streamId));
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/streams/{streamId}/messages: Record a user message optimistically.
     */
    @PostMapping("/{streamId}/messages")
    public ResponseEntity<Object> submitMessage(@PathVariable String streamId,
                                                @RequestBody SubmitMessageRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message text is required"));
        }
        Message message = optimisticWriter.submitUserMessage(streamId, request.text(), request.parentId());
        log.info("Accepted optimistic message {} on stream {}", message.id(), streamId);
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    /**
     * DELETE /api/v1/streams/{streamId}: Tear the stream down.
     */
    @DeleteMapping("/{streamId}")
    public ResponseEntity<Map<String, Object>> deleteStream(@PathVariable String streamId) {
        boolean removed = dispatcher.teardownStream(streamId);
        if (!removed) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Stream not found: " + streamId));
        }
        return ResponseEntity.ok(Map.of("streamId", streamId, "removed", true));
    }
}
