package com.deepcode.backend.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of a chat or URL task.
 */
public class TaskRequest {
    @NotNull
    public String inputSource;

    @NotBlank
    public String inputType;   // "chat" | "url"

    public Boolean enableIndexing;

    public boolean indexingEnabled() {
        return enableIndexing == null || enableIndexing;
    }
}
