package com.syncline.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Execution state of a tool call part.
 *
 * @param status pending, running, completed, failed or error
 * @param input  tool arguments
 * @param output tool result, once completed
 * @param error  failure description, once failed
 */
public record ToolState(
    String status,
    Map<String, Object> input,
    String output,
    String error
) implements Serializable {

    public static ToolState pending() {
        return new ToolState("pending", Map.of(), null, null);
    }
}
