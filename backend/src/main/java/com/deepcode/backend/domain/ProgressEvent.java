package com.deepcode.backend.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Incremental progress pushed to observers. Serialized as {"progress": n, "message": "..."}.
 */
public record ProgressEvent(
        @JsonProperty("progress") int percent,
        @JsonProperty("message") String message
) {
    public ProgressEvent {
        percent = Math.max(0, Math.min(100, percent));
        message = message == null ? "" : message;
    }
}
