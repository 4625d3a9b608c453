package com.deepcode.backend.api;

import com.deepcode.backend.api.dto.TaskRequest;
import com.deepcode.backend.engine.EngineResult;
import com.deepcode.backend.service.ProcessingOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/process")
public class ProcessingController {

    private final ProcessingOrchestrator orchestrator;

    public ProcessingController(ProcessingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
    public JsonNode processText(@Valid @RequestBody TaskRequest req) {
        EngineResult result = orchestrator.processText(req.inputSource, req.inputType, req.indexingEnabled());
        return result.payload();
    }

    @PostMapping(value = "/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public JsonNode processFile(@RequestParam(value = "file", required = false) MultipartFile file,
                                @RequestParam(value = "enable_indexing", defaultValue = "true") boolean enableIndexing) {
        if (file == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file uploaded.");
        }
        EngineResult result = orchestrator.processFile(file, file.getOriginalFilename(), enableIndexing);
        return result.payload();
    }
}
