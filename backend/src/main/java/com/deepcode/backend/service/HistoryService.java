package com.deepcode.backend.service;

import com.deepcode.backend.domain.HistoryEntry;
import com.deepcode.backend.domain.InputType;
import com.deepcode.backend.engine.EngineResult;
import com.deepcode.backend.service.storage.HistoryLedger;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class HistoryService {

    static final int SUMMARY_LIMIT = 500;

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    private final HistoryLedger ledger;

    public HistoryService(HistoryLedger ledger) {
        this.ledger = ledger;
    }

    public List<HistoryEntry> list() {
        return ledger.list();
    }

    public void clear() {
        ledger.clear();
        log.info("Processing history cleared");
    }

    /**
     * Records the outcome of one request. Persistence failures are logged and dropped so that
     * losing history never fails the request itself.
     */
    public void record(InputType type, String source, EngineResult result) {
        HistoryEntry entry = result.isSuccess()
                ? HistoryEntry.success(type, source, summarize(result.payload()))
                : HistoryEntry.error(type, source, result.error());
        append(entry);
    }

    public void recordFault(InputType type, String source, Throwable fault) {
        String msg = fault.getMessage() == null ? fault.getClass().getSimpleName() : fault.getMessage();
        append(HistoryEntry.error(type, source, msg));
    }

    private void append(HistoryEntry entry) {
        try {
            ledger.append(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to record history entry {} ({}): {}", entry.id(), entry.status().code(), e.getMessage());
        }
    }

    static String summarize(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) return "";

        String text = firstText(payload.get("result"), payload.get("analysis_result"), payload.path("repo_result").get("result"));
        if (text == null) {
            text = payload.toString();
        }
        if (text.length() <= SUMMARY_LIMIT) return text;
        int cut = SUMMARY_LIMIT;
        // never split a surrogate pair
        if (Character.isHighSurrogate(text.charAt(cut - 1))) cut--;
        return text.substring(0, cut) + "…";
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode n : candidates) {
            if (n != null && n.isTextual() && !n.asText().isBlank()) return n.asText();
        }
        return null;
    }
}
