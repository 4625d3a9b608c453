package com.deepcode.backend.domain;

/**
 * Normalized descriptor handed to the processing engine.
 * For FILE inputs the source is a local path (the converted PDF when conversion succeeded).
 */
public record ProcessingInput(
        String inputSource,
        InputType inputType,
        boolean enableIndexing
) {}
