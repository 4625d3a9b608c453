package com.deepcode.backend.api;

import com.deepcode.backend.service.ProcessingFailedException;
import com.deepcode.backend.service.storage.HistoryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String code = status == null ? "ERROR" : status.name();
        return ResponseEntity.status(e.getStatusCode())
                .body(Map.of("error", code, "detail", e.getReason() == null ? code : e.getReason()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return Map.of("error", "BAD_REQUEST", "detail", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException e) {
        return Map.of("error", "BAD_REQUEST", "detail", "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of("error", "BAD_REQUEST", "detail", String.valueOf(e.getMessage()));
    }

    @ExceptionHandler(ProcessingFailedException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleProcessingFailed(ProcessingFailedException e) {
        return Map.of("error", "PROCESSING_FAILED", "detail", e.getMessage());
    }

    @ExceptionHandler(HistoryPersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleHistory(HistoryPersistenceException e) {
        log.error("History operation failed", e);
        return Map.of("error", "HISTORY_UNAVAILABLE", "detail", e.getMessage());
    }
}
