package com.librarylogs.ezproxy.config;

import com.librarylogs.ezproxy.model.ProcessingRun;
import com.librarylogs.ezproxy.output.LedgerStore;
import com.librarylogs.ezproxy.service.IngestionCancelledException;
import com.librarylogs.ezproxy.service.LogIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/ingest")
@Slf4j
@RequiredArgsConstructor
public class IngestionController {

    private final LogIngestionService ingestionService;
    private final LedgerStore ledgerStore;
    private final IngesterProperties properties;

    // ── Run triggers ──────────────────────────────────────────────────────────

    @PostMapping("/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        return startInBackground("manual-ingest", ingestionService::syncAndIngest);
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, String>> sync() {
        return startInBackground("manual-sync", ingestionService::syncAll);
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        boolean cancelled = ingestionService.cancel(Duration.ofSeconds(30));
        return ResponseEntity.ok(Map.of("status", cancelled ? "cancelled" : "idle"));
    }

    // ── Ledger queries ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        boolean ledger = ledgerStore.exists();
        return ResponseEntity.ok(Map.of(
                "running", ingestionService.isRunning(),
                "mode", properties.isProduction() ? "production" : "dry-run",
                "ledger", ledger,
                "processedFiles", ledger ? ledgerStore.processedFiles().size() : 0,
                "invalidFiles", ledger ? ledgerStore.invalidFiles().size() : 0
        ));
    }

    /**
     * Ledger history for one file.
     *
     * GET /ingest/runs?filePath=/data/LibraryLogs_RAW/ezproxy/proxyLogs/ezproxy-2020-01.log
     */
    @GetMapping("/runs")
    public ResponseEntity<List<ProcessingRun>> runs(@RequestParam String filePath) {
        return ResponseEntity.ok(ledgerStore.exists() ? ledgerStore.runsFor(filePath) : List.of());
    }

    private ResponseEntity<Map<String, String>> startInBackground(String name, Supplier<?> task) {
        if (ingestionService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An ingestion run is already in progress"));
        }

        new Thread(() -> {
            try {
                Object result = task.get();
                log.info("{} finished: {}", name, result);
            } catch (IngestionCancelledException e) {
                log.warn("{} cancelled: {}", name, e.getMessage());
            } catch (Exception e) {
                log.error("{} failed: {}", name, e.getMessage(), e);
            }
        }, name).start();

        return ResponseEntity.accepted().body(Map.of("status", "accepted", "task", name));
    }
}
