package com.deepcode.backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Final outcome reported by the processing engine.
 * payload is the engine's full response object and is what HTTP callers receive.
 */
public record EngineResult(
        Status status,
        JsonNode payload,
        String error
) {
    public enum Status { SUCCESS, ERROR }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static EngineResult fromPayload(JsonNode payload) {
        JsonNode body = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        String status = body.path("status").asText("");
        String error = body.hasNonNull("error") ? body.get("error").asText() : null;

        boolean failed = "error".equalsIgnoreCase(status) || (status.isBlank() && error != null);
        return new EngineResult(failed ? Status.ERROR : Status.SUCCESS, body,
                failed ? (error == null ? "engine reported an error" : error) : null);
    }

    public static EngineResult success(JsonNode result) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("status", "success");
        body.set("result", result);
        return new EngineResult(Status.SUCCESS, body, null);
    }

    public static EngineResult error(String message) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("status", "error");
        body.put("error", message);
        return new EngineResult(Status.ERROR, body, message);
    }
}
