package com.whereq.vigil.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for WhereQ Vigil.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "vigil")
@Data
public class VigilProperties {

    /**
     * Root directory for runtime state.
     */
    private Path runtimeDir = Paths.get(System.getProperty("java.io.tmpdir"), "vigil");

    /**
     * Directory holding one lock marker per job. Defaults to {@code <runtime-dir>/locks}.
     */
    private Path lockDir;

    /**
     * Directory holding one log subdirectory per job.
     */
    private Path logDir = Paths.get("logs");

    /**
     * Directory holding fetched snapshots.
     */
    private Path dataDir = Paths.get("data");

    /**
     * Scan worker concurrency.
     */
    private int threads = 100;

    /**
     * Debug verbosity for the com.whereq.vigil loggers.
     */
    private boolean debug = false;

    /**
     * Log files kept per job.
     */
    private int logRetention = 10;

    /**
     * Time a managed process gets to exit after a polite termination request.
     */
    private Duration shutdownGrace = Duration.ofSeconds(5);

    private LockConfig lock = new LockConfig();

    private FetchConfig fetch = new FetchConfig();

    private ScanConfig scan = new ScanConfig();

    private SinkConfig sink = new SinkConfig();

    /**
     * Static job registry. Iteration order is the canonical "all" order.
     */
    private Map<String, JobConfig> jobs = new LinkedHashMap<>();

    public Path resolveLockDir() {
        return lockDir != null ? lockDir : runtimeDir.resolve("locks");
    }

    @Data
    public static class LockConfig {
        /**
         * How often a held marker's heartbeat is refreshed.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(15);

        /**
         * A marker whose heartbeat is older than this is considered dead.
         */
        private Duration staleAfter = Duration.ofSeconds(90);
    }

    @Data
    public static class FetchConfig {
        /**
         * A snapshot must be strictly larger than this many bytes.
         */
        private long minBytes = 10;

        /**
         * Default fetch phase timeout.
         */
        private Duration timeout = Duration.ofSeconds(300);
    }

    @Data
    public static class ScanConfig {
        /**
         * Deadline of a single probe.
         */
        private Duration probeTimeout = Duration.ofSeconds(30);

        /**
         * Connect timeout of a probe. All ports of a host are checked at once, so this bounds one probe.
         */
        private Duration connectTimeout = Duration.ofSeconds(2);

        /**
         * Findings per sink flush.
         */
        private int batchSize = 100;

        /**
         * Emit progress every N completed targets.
         */
        private int progressEvery = 100;

        /**
         * Emit progress at least this often.
         */
        private Duration progressInterval = Duration.ofSeconds(30);

        /**
         * Failed targets listed in the completion summary.
         */
        private int failurePreview = 10;

        /**
         * Ports checked by the TCP probe.
         */
        private List<Integer> ports = new ArrayList<>(List.of(
            21, 22, 23, 25, 53, 80, 110, 143, 443, 465, 587, 993, 995,
            2375, 3000, 3306, 5432, 6379, 8000, 8001, 8080, 8443, 8899, 8900, 9090, 9100));
    }

    @Data
    public static class SinkConfig {
        /**
         * Sink implementation: REDIS or MEMORY.
         */
        private SinkType type = SinkType.REDIS;

        /**
         * Key namespace in Redis.
         */
        private String keyPrefix = "vigil";

        /**
         * Snapshot records per upsert.
         */
        private int batchSize = 500;

        /**
         * Deadline of one batch upsert.
         */
        private Duration writeTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class JobConfig {
        /**
         * What the process phase does.
         */
        private JobKind kind = JobKind.SNAPSHOT;

        /**
         * External command whose stdout is the fetched document. No fetch phase when empty.
         */
        private List<String> fetchCommand = new ArrayList<>();

        /**
         * Fetch phase timeout, falls back to vigil.fetch.timeout.
         */
        private Duration fetchTimeout;

        /**
         * Process phase timeout.
         */
        private Duration timeout = Duration.ofSeconds(600);

        /**
         * Snapshot file name under the data directory. Defaults to {@code <job>_data.json}.
         */
        private String snapshot;

        /**
         * Sink table the process phase writes to.
         */
        private String table;

        /**
         * Field carrying the record identity.
         */
        private String identityField = "identityPubkey";

        /**
         * Field holding the record array when the document is an object.
         */
        private String recordsPath;

        /**
         * Fields a record must carry to be persisted.
         */
        private List<String> requiredFields = new ArrayList<>();

        /**
         * Command run by a COMMAND job; {snapshot} is replaced with the snapshot path.
         */
        private List<String> processCommand = new ArrayList<>();

        /**
         * Job whose snapshot supplies SCAN targets.
         */
        private String targetsFrom;

        /**
         * Field carrying the host address in the target snapshot.
         */
        private String addressField = "ipAddress";

        /**
         * Maximum number of targets scanned, 0 for all.
         */
        private int limit = 0;
    }

    public enum JobKind {
        /**
         * Upsert the fetched snapshot's records into the sink
         */
        SNAPSHOT,

        /**
         * Run an external program over the snapshot
         */
        COMMAND,

        /**
         * Probe every target host with bounded concurrency
         */
        SCAN
    }

    public enum SinkType {
        REDIS,
        MEMORY
    }
}
