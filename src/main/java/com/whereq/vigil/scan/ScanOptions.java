package com.whereq.vigil.scan;

import com.whereq.vigil.config.VigilProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Parameters of one scan batch
 */
@Value
@Builder(toBuilder = true)
public class ScanOptions {

    /**
     * Sink table findings are written to
     */
    String table;

    /**
     * Maximum probes in flight
     */
    int concurrency;

    Duration probeTimeout;

    int batchSize;

    int progressEvery;

    Duration progressInterval;

    int failurePreview;

    /**
     * Capture time shared by every record of the batch, now when null
     */
    Instant captureTime;

    public static ScanOptions from(VigilProperties.ScanConfig scan, String table, int concurrency, Instant captureTime) {
        return ScanOptions.builder()
            .table(table)
            .concurrency(concurrency)
            .probeTimeout(scan.getProbeTimeout())
            .batchSize(scan.getBatchSize())
            .progressEvery(scan.getProgressEvery())
            .progressInterval(scan.getProgressInterval())
            .failurePreview(scan.getFailurePreview())
            .captureTime(captureTime)
            .build();
    }
}
