package com.deepcode.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "deepcode")
public record DeepCodeProperties(
        @DefaultValue Storage storage,
        @DefaultValue Engine engine,
        @DefaultValue Conversion conversion,
        @DefaultValue Progress progress
) {

    public record Storage(
            @DefaultValue("temp_uploads") Path scratchDir,
            @DefaultValue("data/processing_history.json") Path historyFile,
            @DefaultValue("false") boolean purgeOrphansOnStartup
    ) {}

    public record Engine(
            @DefaultValue("") String baseUrl,
            @DefaultValue("10s") Duration connectTimeout,
            @DefaultValue("30m") Duration readTimeout,
            @DefaultValue("4") int workerThreads
    ) {}

    public record Conversion(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("soffice") String command,
            @DefaultValue("2m") Duration timeout
    ) {}

    public record Progress(
            @DefaultValue("/ws/progress") String path,
            @DefaultValue("*") List<String> allowedOrigins,
            @DefaultValue("5s") Duration sendTimeLimit,
            @DefaultValue("524288") int bufferSizeLimit
    ) {}
}
