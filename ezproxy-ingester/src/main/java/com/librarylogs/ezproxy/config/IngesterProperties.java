package com.librarylogs.ezproxy.config;

import com.librarylogs.ezproxy.model.LogSource;
import com.librarylogs.ezproxy.model.SyncTarget;
import com.librarylogs.ezproxy.output.SqlDialect;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "ezproxy")
@Data
public class IngesterProperties {

    /** Off by default: nothing is copied or written until this is switched on. */
    private boolean production = false;

    /**
     * Lines read per batch. Large batches are faster to load but the whole batch
     * is held in memory, so lower this on small hosts.
     */
    private int chunkSize = 1_000_000;

    private int insertBatchSize = 1000;

    /** Optional JSON file of log sources; overrides {@link #sources} when set. */
    private String configFile;

    private List<LogSource> sources = new ArrayList<>();
    private Sync sync = new Sync();
    private Sink sink = new Sink();
    private Preview preview = new Preview();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Sync {
        private List<SyncTarget> targets = new ArrayList<>();
        private Duration lag = Duration.ofDays(1);
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
        private LocalDateTime defaultWatermark = LocalDateTime.of(2000, 1, 1, 0, 0);
    }

    @Data
    public static class Sink {
        private SqlDialect dialect = SqlDialect.SQLSERVER;
        private boolean createSchema = true;
    }

    @Data
    public static class Preview {
        private PreviewMode mode = PreviewMode.LOG;
        private String outputDir = "./preview";
        private boolean includeHeader = true;
        private int sampleRows = 5;

        public enum PreviewMode {
            LOG, CSV
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
        private boolean syncBeforeIngest = true;
    }
}
