package com.deepcode.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoryStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String code;

    HistoryStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static HistoryStatus of(String code) {
        for (HistoryStatus s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("unknown status: " + code);
    }
}
