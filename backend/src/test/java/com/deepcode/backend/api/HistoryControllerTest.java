package com.deepcode.backend.api;

import com.deepcode.backend.config.JacksonConfig;
import com.deepcode.backend.domain.HistoryEntry;
import com.deepcode.backend.domain.InputType;
import com.deepcode.backend.service.HistoryService;
import com.deepcode.backend.service.storage.HistoryLedger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HistoryControllerTest {

    @TempDir
    Path dir;

    private final ObjectMapper om = JacksonConfig.create();
    private HistoryLedger ledger;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ledger = new HistoryLedger(om, dir.resolve("history.json"), HistoryLedger.MAX_ENTRIES);
        mvc = mvcFor(ledger);
    }

    private MockMvc mvcFor(HistoryLedger l) {
        return MockMvcBuilders.standaloneSetup(new HistoryController(new HistoryService(l)))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void listsEntriesOldestFirstInSnakeCase() throws Exception {
        ledger.append(HistoryEntry.success(InputType.URL, "https://example.org", "summary"));
        ledger.append(HistoryEntry.error(InputType.FILE, "deck.pptx", "unsupported format"));

        mvc.perform(get("/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].input_type").value("url"))
                .andExpect(jsonPath("$[0].status").value("success"))
                .andExpect(jsonPath("$[0].result_summary").value("summary"))
                .andExpect(jsonPath("$[0].error_message").doesNotExist())
                .andExpect(jsonPath("$[1].input_source").value("deck.pptx"))
                .andExpect(jsonPath("$[1].error_message").value("unsupported format"))
                .andExpect(jsonPath("$[1].timestamp").isString());
    }

    @Test
    void clearThenListIsEmpty() throws Exception {
        ledger.append(HistoryEntry.success(InputType.CHAT, "hi", "ok"));

        mvc.perform(delete("/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
        mvc.perform(get("/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void clearFailureIs500() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");

        mvcFor(new HistoryLedger(om, blocker.resolve("history.json"), 50))
                .perform(delete("/history"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("HISTORY_UNAVAILABLE"));
    }
}
