package com.deepcode.backend.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InputTypeTest {

    @Test
    void wireCodesMatchExactly() {
        assertEquals(Optional.of(InputType.CHAT), InputType.fromCode("chat"));
        assertEquals(Optional.of(InputType.URL), InputType.fromCode("url"));
        assertEquals(Optional.of(InputType.FILE), InputType.fromCode("file"));
    }

    @Test
    void paddedOrDifferentlyCasedCodesAreRejected() {
        assertTrue(InputType.fromCode(" Chat ").isEmpty());
        assertTrue(InputType.fromCode("CHAT").isEmpty());
        assertTrue(InputType.fromCode("url ").isEmpty());
        assertTrue(InputType.fromCode("").isEmpty());
        assertTrue(InputType.fromCode(null).isEmpty());
    }

    @Test
    void jsonCreatorRejectsUnknownCodes() {
        assertEquals(InputType.FILE, InputType.of("file"));
        assertThrows(IllegalArgumentException.class, () -> InputType.of("File"));
    }
}
