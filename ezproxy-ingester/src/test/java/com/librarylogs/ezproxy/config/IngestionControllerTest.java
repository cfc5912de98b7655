package com.librarylogs.ezproxy.config;

import com.librarylogs.ezproxy.model.ProcessingRun;
import com.librarylogs.ezproxy.output.LedgerStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:hsqldb:mem:ingestion-controller",
        "spring.datasource.username=SA",
        "spring.datasource.password=",
        "ezproxy.production=true",
        "ezproxy.sink.dialect=HSQLDB",
        "ezproxy.sink.create-schema=true",
        "ezproxy.scheduling.run-on-startup=false"
})
@AutoConfigureMockMvc
class IngestionControllerTest {

    private static final String FILE = "/data/LibraryLogs_RAW/ezproxy/proxyLogs/ezproxy-2020-01.log";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LedgerStore ledgerStore;

    @Test
    void status_reportsIdleProductionIngester() throws Exception {
        mockMvc.perform(get("/ingest/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.mode").value("production"))
                .andExpect(jsonPath("$.ledger").value(true));
    }

    @Test
    void runs_returnsLedgerHistoryForFile() throws Exception {
        ledgerStore.recordRun(ProcessingRun.builder()
                .filePath(FILE)
                .logType("proxyLogs")
                .processingStartTime(LocalDateTime.of(2020, 2, 1, 3, 0, 0))
                .processingEndTime(LocalDateTime.of(2020, 2, 1, 3, 4, 10))
                .valid(true)
                .numOfLogs(42)
                .numInvalid(1)
                .build());

        mockMvc.perform(get("/ingest/runs").param("filePath", FILE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].valid").value(true))
                .andExpect(jsonPath("$[0].numOfLogs").value(42))
                .andExpect(jsonPath("$[0].processingStartTime").value("2020-02-01T03:00:00"));
    }

    @Test
    void cancel_withNothingRunning_isIdle() throws Exception {
        mockMvc.perform(post("/ingest/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("idle"));
    }
}
