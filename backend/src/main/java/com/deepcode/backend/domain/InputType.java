package com.deepcode.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum InputType {
    CHAT("chat"),
    URL("url"),
    FILE("file");

    private final String code;

    InputType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Exact, case-sensitive match on the wire code. */
    public static Optional<InputType> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
    }

    @JsonCreator
    public static InputType of(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("unknown input_type: " + code));
    }
}
