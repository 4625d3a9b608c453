package com.deepcode.backend.engine;

import com.deepcode.backend.config.DeepCodeProperties;
import com.deepcode.backend.domain.ProcessingInput;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Talks to the engine over HTTP: POST {base-url}/process with the input descriptor, JSON result back.
 */
@Component
public class RestProcessingEngine implements ProcessingEngine {

    private static final Logger log = LoggerFactory.getLogger(RestProcessingEngine.class);

    private final RestClient client;
    private final Executor executor;
    private final String baseUrl;

    public RestProcessingEngine(RestClient.Builder builder,
                                DeepCodeProperties props,
                                @Qualifier("engineExecutor") Executor executor) {
        DeepCodeProperties.Engine cfg = props.engine();
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout((int) cfg.connectTimeout().toMillis());
        rf.setReadTimeout((int) cfg.readTimeout().toMillis());

        this.baseUrl = cfg.baseUrl() == null ? "" : cfg.baseUrl().trim();
        this.executor = executor;
        this.client = builder.clone()
                .requestFactory(rf)
                .baseUrl(baseUrl.isEmpty() ? "http://localhost" : baseUrl)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return !baseUrl.isEmpty();
    }

    @Override
    public CompletableFuture<EngineResult> process(ProcessingInput input, ProgressHook hook) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("processing engine is not configured (deepcode.engine.base-url)"));
        }
        ProgressHook progress = hook == null ? ProgressHook.noop() : hook;

        return CompletableFuture.supplyAsync(() -> {
            progress.report(5, "Dispatching to processing engine");
            log.debug("engine call type={} indexing={}", input.inputType().code(), input.enableIndexing());

            JsonNode body = client.post()
                    .uri("/process")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "input_source", input.inputSource(),
                            "input_type", input.inputType().code(),
                            "enable_indexing", input.enableIndexing()))
                    .retrieve()
                    .body(JsonNode.class);

            progress.report(100, "Processing engine finished");
            return EngineResult.fromPayload(body);
        }, executor);
    }
}
