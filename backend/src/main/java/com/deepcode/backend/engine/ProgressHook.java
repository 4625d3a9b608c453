package com.deepcode.backend.engine;

/**
 * Callback an engine invokes zero or more times before its final result.
 */
@FunctionalInterface
public interface ProgressHook {

    void report(int percent, String message);

    static ProgressHook noop() {
        return (percent, message) -> { };
    }
}
