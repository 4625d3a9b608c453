package com.deepcode.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One finished request as recorded in the processing history.
 * resultSummary is set only for SUCCESS, errorMessage only for ERROR.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
        String id,
        Instant timestamp,
        HistoryStatus status,
        InputType inputType,
        String inputSource,   // original filename for FILE, verbatim source otherwise
        String resultSummary,
        String errorMessage
) {
    public HistoryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(inputType, "inputType");
    }

    public static HistoryEntry success(InputType type, String source, String summary) {
        return new HistoryEntry(UUID.randomUUID().toString(), Instant.now(),
                HistoryStatus.SUCCESS, type, source, summary == null ? "" : summary, null);
    }

    public static HistoryEntry error(InputType type, String source, String message) {
        return new HistoryEntry(UUID.randomUUID().toString(), Instant.now(),
                HistoryStatus.ERROR, type, source, null, message == null ? "" : message);
    }
}
