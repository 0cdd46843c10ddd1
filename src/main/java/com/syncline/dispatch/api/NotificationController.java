package com.syncline.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events endpoint for notifications and projection changes.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final NotificationStreamingService streamingService;

    public NotificationController(NotificationStreamingService streamingService) {
        this.streamingService = streamingService;
    }

    /**
     * GET /api/v1/notifications/stream: All streams, or one with {@code ?streamId=}.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String streamId) {
        return streamingService.createEmitter(streamId);
    }
}
