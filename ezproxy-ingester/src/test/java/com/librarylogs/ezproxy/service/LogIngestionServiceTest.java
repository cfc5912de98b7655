package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.IngestionSummary;
import com.librarylogs.ezproxy.model.LogSource;
import com.librarylogs.ezproxy.model.ProcessingRun;
import com.librarylogs.ezproxy.output.LedgerException;
import com.librarylogs.ezproxy.output.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogIngestionServiceTest {

    private static final Path PROXY_DIR = Paths.get("/archive/proxyLogs");
    private static final Path FILE_A = PROXY_DIR.resolve("proxylogs-1.log");
    private static final Path FILE_B = PROXY_DIR.resolve("proxylogs-2.log");
    private static final Path FILE_C = PROXY_DIR.resolve("proxylogs-3.log");

    @Mock private LogSourceLoader sourceLoader;
    @Mock private LogParserRegistry parserRegistry;
    @Mock private FileIngestionEngine engine;
    @Mock private FileSynchronizer synchronizer;
    @Mock private LedgerStore ledgerStore;
    @Mock private FileStore fileStore;

    private final LogParser parser = new EzproxyLogParser();
    private IngesterProperties properties;
    private LogIngestionService service;

    @BeforeEach
    void setUp() {
        properties = new IngesterProperties();
        service = new LogIngestionService(sourceLoader, parserRegistry, engine, synchronizer,
                ledgerStore, fileStore, properties);
        lenient().when(ledgerStore.exists()).thenReturn(true);
    }

    @Test
    void ingestAll_skipsFilesWithSuccessfulRun() throws IOException {
        givenSourceWithFiles(FILE_A, FILE_B);
        when(ledgerStore.processedFiles()).thenReturn(Set.of(FILE_A.toString()));
        when(engine.processFile(FILE_B, "proxyLogs", parser, false)).thenReturn(run(FILE_B, true));

        IngestionSummary summary = service.ingestAll();

        assertThat(summary).isEqualTo(new IngestionSummary(1, 0, 1));
        verify(engine, never()).processFile(eq(FILE_A), anyString(), any(), anyBoolean());
    }

    @Test
    void ingestAll_dryRunWithoutLedgerTable_treatsEveryFileAsNew() throws IOException {
        givenSourceWithFiles(FILE_A, FILE_B);
        when(ledgerStore.exists()).thenReturn(false);
        when(engine.processFile(FILE_A, "proxyLogs", parser, false)).thenReturn(run(FILE_A, true));
        when(engine.processFile(FILE_B, "proxyLogs", parser, false)).thenReturn(run(FILE_B, true));

        IngestionSummary summary = service.ingestAll();

        assertThat(summary).isEqualTo(new IngestionSummary(2, 0, 0));
        verify(ledgerStore, never()).processedFiles();
    }

    @Test
    void ingestAll_failedFileDoesNotStopTheRun() throws IOException {
        givenSourceWithFiles(FILE_A, FILE_B, FILE_C);
        when(ledgerStore.processedFiles()).thenReturn(Set.of());
        when(engine.processFile(FILE_A, "proxyLogs", parser, false)).thenReturn(run(FILE_A, false));
        when(engine.processFile(FILE_B, "proxyLogs", parser, false)).thenThrow(new IllegalStateException("boom"));
        when(engine.processFile(FILE_C, "proxyLogs", parser, false)).thenReturn(run(FILE_C, true));

        IngestionSummary summary = service.ingestAll();

        assertThat(summary).isEqualTo(new IngestionSummary(1, 2, 0));
    }

    @Test
    void ingestAll_ledgerFailureStopsTheRun() throws IOException {
        givenSourceWithFiles(FILE_A, FILE_B);
        when(ledgerStore.processedFiles()).thenReturn(Set.of());
        when(engine.processFile(FILE_A, "proxyLogs", parser, false))
                .thenThrow(new LedgerException("Ledger failed to record run", null));

        assertThatThrownBy(service::ingestAll).isInstanceOf(LedgerException.class);

        verify(engine, never()).processFile(eq(FILE_B), anyString(), any(), anyBoolean());
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void ingestAll_unreadableDirectoryIsSkipped() throws IOException {
        LogSource broken = new LogSource("/archive/missing", "accessLogs", EzproxyLogParser.DIALECT);
        LogSource proxy = new LogSource(PROXY_DIR.toString(), "proxyLogs", EzproxyLogParser.DIALECT);
        when(sourceLoader.sources()).thenReturn(List.of(broken, proxy));
        when(parserRegistry.getParser(EzproxyLogParser.DIALECT)).thenReturn(parser);
        when(fileStore.walk(Paths.get("/archive/missing"))).thenThrow(new IOException("not mounted"));
        when(fileStore.walk(PROXY_DIR)).thenReturn(List.of(FILE_A));
        when(ledgerStore.processedFiles()).thenReturn(Set.of());
        when(engine.processFile(FILE_A, "proxyLogs", parser, false)).thenReturn(run(FILE_A, true));

        assertThat(service.ingestAll()).isEqualTo(new IngestionSummary(1, 0, 0));
    }

    @Test
    void syncAndIngest_syncsBeforeReadingTheLedger() throws IOException {
        properties.setProduction(true);
        givenSourceWithFiles();
        when(ledgerStore.processedFiles()).thenReturn(Set.of());

        service.syncAndIngest();

        InOrder order = inOrder(synchronizer, ledgerStore);
        order.verify(synchronizer).syncAll(true);
        order.verify(ledgerStore).processedFiles();
    }

    @Test
    void syncAndIngest_withSyncDisabled_onlyIngests() {
        properties.getScheduling().setSyncBeforeIngest(false);
        when(sourceLoader.sources()).thenReturn(List.of());
        when(ledgerStore.processedFiles()).thenReturn(Set.of());

        assertThat(service.syncAndIngest()).isEqualTo(IngestionSummary.EMPTY);
        verify(synchronizer, never()).syncAll(anyBoolean());
    }

    @Test
    void ingestAll_refusesSecondConcurrentRun() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        givenSourceWithFiles(FILE_A);
        when(ledgerStore.processedFiles()).thenReturn(Set.of());
        when(engine.processFile(FILE_A, "proxyLogs", parser, false)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return run(FILE_A, true);
        });

        Thread first = new Thread(service::ingestAll);
        first.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(service::ingestAll)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already in progress");

        release.countDown();
        first.join(5000);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void cancel_interruptsRunningFileAndStopsTheRun() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicReference<Throwable> outcome = new AtomicReference<>();
        givenSourceWithFiles(FILE_A, FILE_B);
        when(ledgerStore.processedFiles()).thenReturn(Set.of());
        when(engine.processFile(FILE_A, "proxyLogs", parser, false)).thenAnswer(invocation -> {
            entered.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                throw new IngestionCancelledException(FILE_A.toString(), e);
            }
            return run(FILE_A, true);
        });

        Thread worker = new Thread(() -> {
            try {
                service.ingestAll();
            } catch (Throwable t) {
                outcome.set(t);
            }
        });
        worker.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.cancel(Duration.ofSeconds(5))).isTrue();

        assertThat(worker.isAlive()).isFalse();
        assertThat(outcome.get()).isInstanceOf(IngestionCancelledException.class);
        verify(engine, never()).processFile(eq(FILE_B), anyString(), any(), anyBoolean());
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void cancel_withoutRun_returnsFalse() {
        assertThat(service.cancel(Duration.ofMillis(10))).isFalse();
    }

    private void givenSourceWithFiles(Path... files) throws IOException {
        when(sourceLoader.sources()).thenReturn(List.of(
                new LogSource(PROXY_DIR.toString(), "proxyLogs", EzproxyLogParser.DIALECT)));
        when(parserRegistry.getParser(EzproxyLogParser.DIALECT)).thenReturn(parser);
        when(fileStore.walk(PROXY_DIR)).thenReturn(List.of(files));
    }

    private static ProcessingRun run(Path file, boolean valid) {
        return ProcessingRun.builder()
                .filePath(file.toString())
                .logType("proxyLogs")
                .valid(valid)
                .build();
    }
}
