package com.syncline.dispatch.api;

/**
 * Body of {@code POST /api/v1/streams/{streamId}/messages}.
 */
public record SubmitMessageRequest(String text, String parentId) {}
