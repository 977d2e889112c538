package com.whereq.vigil.job;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.model.ScanReport;
import com.whereq.vigil.model.ScanTarget;
import com.whereq.vigil.scan.ScanEngine;
import com.whereq.vigil.scan.ScanOptions;
import com.whereq.vigil.scan.TargetProbe;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Process phase of the scan job: probe every target of the source snapshot with
 * bounded concurrency and persist the findings.
 */
@Slf4j
public class PortScanStep implements ProcessStep {

    private final String table;
    private final SnapshotTargetSource targets;
    private final TargetProbe probe;
    private final ScanEngine scanEngine;
    private final VigilProperties properties;

    public PortScanStep(String table, SnapshotTargetSource targets, TargetProbe probe,
                        ScanEngine scanEngine, VigilProperties properties) {
        this.table = table;
        this.targets = targets;
        this.probe = probe;
        this.scanEngine = scanEngine;
        this.properties = properties;
    }

    @Override
    public void process(RunContext context) {
        List<ScanTarget> batch = targets.load();
        int threads = context.getThreads() != null ? context.getThreads() : properties.getThreads();

        ScanOptions options = ScanOptions.from(properties.getScan(), table, threads, context.getStartedAt());
        ScanReport report = scanEngine.scan(batch, probe, options);
        log.info("Scan of {} targets finished: {} succeeded, {} failed, {} findings persisted",
            report.getTotal(), report.getSucceeded(), report.getFailed(), report.getFindingsPersisted());
    }
}
