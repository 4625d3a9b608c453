package com.deepcode.backend.service;

import com.deepcode.backend.domain.ArtifactKind;
import com.deepcode.backend.domain.InputType;
import com.deepcode.backend.domain.ProcessingInput;
import com.deepcode.backend.domain.StagedArtifact;
import com.deepcode.backend.engine.EngineResult;
import com.deepcode.backend.engine.ProcessingEngine;
import com.deepcode.backend.engine.ProgressHook;
import com.deepcode.backend.service.conversion.ConversionAdapter;
import com.deepcode.backend.service.progress.ProgressBroadcaster;
import com.deepcode.backend.service.storage.ArtifactScope;
import com.deepcode.backend.service.storage.ArtifactStore;
import com.deepcode.backend.service.storage.ScratchDirectoryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.io.InputStreamSource;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs one processing request end to end:
 * validate, stage, convert (best effort), dispatch to the engine, record history, clean up.
 *
 * <p>Each request calls the engine at most once. Once a request is past validation and the scratch
 * directory is usable, exactly one history entry is written whatever the outcome, and every staged
 * artifact is released before the caller gets its response.
 */
@Service
public class ProcessingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProcessingOrchestrator.class);
    private static final Set<InputType> TEXT_TYPES = Set.of(InputType.CHAT, InputType.URL);

    private final ArtifactStore artifacts;
    private final ConversionAdapter conversion;
    private final ProcessingEngine engine;
    private final ProgressBroadcaster broadcaster;
    private final HistoryService history;

    public ProcessingOrchestrator(ArtifactStore artifacts,
                                  ConversionAdapter conversion,
                                  ProcessingEngine engine,
                                  ProgressBroadcaster broadcaster,
                                  HistoryService history) {
        this.artifacts = artifacts;
        this.conversion = conversion;
        this.engine = engine;
        this.broadcaster = broadcaster;
        this.history = history;
    }

    public EngineResult processText(String inputSource, String inputType, boolean enableIndexing) {
        InputType type = InputType.fromCode(inputType)
                .filter(TEXT_TYPES::contains)
                .orElseThrow(() -> bad("Invalid input_type. Must be 'chat' or 'url'."));
        if (inputSource == null) {
            throw bad("input_source is required");
        }

        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        try {
            log.info("Processing {} request", type.code());
            return dispatch(new ProcessingInput(inputSource, type, enableIndexing), inputSource);
        } finally {
            MDC.remove("requestId");
        }
    }

    public EngineResult processFile(InputStreamSource upload, String originalFilename, boolean enableIndexing) {
        if (upload == null) {
            throw bad("No file uploaded.");
        }
        String displayName = (originalFilename == null || originalFilename.isBlank()) ? "upload" : originalFilename;

        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        try (ArtifactScope scope = artifacts.openScope(requestId)) {
            StagedArtifact staged = stage(scope, upload, displayName);

            Path source = staged.path();
            Optional<Path> converted = conversion.convertIfNeeded(source);
            converted.ifPresent(p -> scope.adopt(p, ArtifactKind.CONVERTED));
            if (converted.isPresent()) {
                source = converted.get();
                log.info("Processing file {} (converted to PDF)", displayName);
            } else {
                log.info("Processing file {}", displayName);
            }

            return dispatch(new ProcessingInput(source.toString(), InputType.FILE, enableIndexing), displayName);
        } finally {
            MDC.remove("requestId");
        }
    }

    private StagedArtifact stage(ArtifactScope scope, InputStreamSource upload, String filename) {
        try {
            return scope.stage(upload, filename);
        } catch (ScratchDirectoryUnavailableException e) {
            // the upload was never read, so nothing is recorded
            log.error("Cannot stage upload {}", filename, e);
            throw new ProcessingFailedException("An error occurred during processing: " + describe(e), e);
        } catch (IOException | RuntimeException e) {
            log.error("Staging upload {} failed", filename, e);
            history.recordFault(InputType.FILE, filename, e);
            throw new ProcessingFailedException("An error occurred during processing: " + describe(e), e);
        }
    }

    private EngineResult dispatch(ProcessingInput input, String historySource) {
        EngineResult result;
        try {
            result = await(engine.process(input, progressHook()));
            if (result == null) {
                throw new IllegalStateException("processing engine returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Processing {} request failed", input.inputType().code(), e);
            history.recordFault(input.inputType(), historySource, e);
            throw new ProcessingFailedException("An error occurred during processing: " + describe(e), e);
        }

        history.record(input.inputType(), historySource, result);
        if (result.isSuccess()) {
            log.info("Processing {} request succeeded", input.inputType().code());
        } else {
            log.warn("Engine reported an error for {} request: {}", input.inputType().code(), result.error());
        }
        return result;
    }

    private ProgressHook progressHook() {
        ProgressHook forward = broadcaster.hook();
        return (percent, message) -> {
            try {
                forward.report(percent, message);
            } catch (RuntimeException e) {
                log.warn("Progress broadcast failed: {}", e.getMessage());
            }
        };
    }

    private static EngineResult await(CompletableFuture<EngineResult> future) {
        if (future == null) {
            throw new IllegalStateException("processing engine returned no future");
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for the processing engine", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new CompletionException(cause);
        } catch (CancellationException e) {
            throw new IllegalStateException("processing engine call was cancelled", e);
        }
    }

    private static String describe(Throwable e) {
        Throwable t = (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static ResponseStatusException bad(String msg) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, msg);
    }
}
