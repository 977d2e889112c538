package com.whereq.vigil.scan;

import com.whereq.vigil.model.ProbeResult;
import com.whereq.vigil.model.ScanReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Logs scan progress every N completed targets and on demand, plus the completion summary.
 */
@Slf4j
public class ScanProgressReporter {

    private final ScanBatch batch;
    private final int every;

    public ScanProgressReporter(ScanBatch batch, int every) {
        this.batch = batch;
        this.every = Math.max(1, every);
    }

    public void onCompleted(int completed) {
        if (completed % every == 0 || completed == batch.getTotal()) {
            report();
        }
    }

    public void report() {
        int total = batch.getTotal();
        int completed = batch.getCompleted().get();
        Duration elapsed = Duration.between(batch.getStartedAt(), Instant.now());
        double rate = rate(completed, elapsed);
        String eta = eta(total, completed, rate)
            .map(ScanProgressReporter::format)
            .orElse("unknown");

        log.info("Progress: {}/{} ({}%) | ok {} | failed {} | elapsed {} | rate {}/s | ETA {}",
            completed, total, String.format("%.1f", percent(completed, total)),
            batch.getSucceeded().get(), batch.getFailed().get(),
            format(elapsed), String.format("%.2f", rate), eta);
    }

    public void summary(ScanReport report) {
        log.info("=== SCAN COMPLETE ===");
        log.info("Targets scanned: {}/{} (succeeded {}, failed {})",
            report.getCompleted(), report.getTotal(), report.getSucceeded(), report.getFailed());
        log.info("Findings persisted: {}", report.getFindingsPersisted());
        log.info("Total time: {} | average rate {}/s",
            format(report.getElapsed()), String.format("%.2f", report.getAverageRate()));

        if (report.getFailed() > 0) {
            log.warn("Failed targets ({}):", report.getFailed());
            for (ProbeResult failure : report.getFailurePreview()) {
                log.warn("  - {} ({})", failure.getTarget().getAddress(), failure.getError());
            }
            int hidden = report.getFailed() - report.getFailurePreview().size();
            if (hidden > 0) {
                log.warn("  ... and {} more", hidden);
            }
        }
    }

    /**
     * Targets per second.
     */
    public static double rate(int completed, Duration elapsed) {
        double seconds = elapsed.toMillis() / 1000.0;
        return seconds > 0 ? completed / seconds : 0.0;
    }

    /**
     * Time left at the current rate, empty while the rate is unknown.
     */
    public static Optional<Duration> eta(int total, int completed, double rate) {
        int remaining = Math.max(0, total - completed);
        if (remaining == 0) {
            return Optional.of(Duration.ZERO);
        }
        if (rate <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(remaining / rate * 1000)));
    }

    static double percent(int completed, int total) {
        return total > 0 ? completed * 100.0 / total : 100.0;
    }

    static String format(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
