package com.deepcode.backend.api;

import com.deepcode.backend.engine.ProcessingEngine;
import com.deepcode.backend.service.conversion.ConversionAdapter;
import com.deepcode.backend.service.progress.ProgressBroadcaster;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ConversionAdapter conversion;
    private final ProcessingEngine engine;
    private final ProgressBroadcaster broadcaster;

    public HealthController(ConversionAdapter conversion, ProcessingEngine engine, ProgressBroadcaster broadcaster) {
        this.conversion = conversion;
        this.engine = engine;
        this.broadcaster = broadcaster;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of("status", "ok", "message", "Welcome to the DeepCode API");
    }

    @GetMapping("/diagnostics")
    public Map<String, Object> diagnostics() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("java_version", System.getProperty("java.version"));
        out.put("platform", System.getProperty("os.name") + " " + System.getProperty("os.arch"));
        out.put("modules", Map.of(
                "document_converter", conversion.isConverterAvailable(),
                "processing_engine", engine.isAvailable()));
        out.put("observers", broadcaster.observerCount());
        return out;
    }
}
