package com.deepcode.backend.api;

import com.deepcode.backend.domain.HistoryEntry;
import com.deepcode.backend.service.HistoryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/history")
public class HistoryController {

    private final HistoryService history;

    public HistoryController(HistoryService history) {
        this.history = history;
    }

    @GetMapping
    public List<HistoryEntry> list() {
        return history.list();
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        history.clear();
        return Map.of("ok", true);
    }
}
