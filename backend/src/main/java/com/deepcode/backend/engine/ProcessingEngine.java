package com.deepcode.backend.engine;

import com.deepcode.backend.domain.ProcessingInput;

import java.util.concurrent.CompletableFuture;

/**
 * The external content-processing engine. Each call is made at most once per request;
 * a structured engine failure completes normally with an ERROR result, anything else
 * completes the future exceptionally.
 */
public interface ProcessingEngine {

    CompletableFuture<EngineResult> process(ProcessingInput input, ProgressHook hook);

    default boolean isAvailable() {
        return true;
    }
}
