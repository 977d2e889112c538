package com.whereq.vigil.scan;

import com.whereq.vigil.exception.SinkUnavailableException;
import com.whereq.vigil.executor.OperationOutcome;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import com.whereq.vigil.model.OpenPort;
import com.whereq.vigil.model.ProbeResult;
import com.whereq.vigil.model.ScanReport;
import com.whereq.vigil.model.ScanTarget;
import com.whereq.vigil.model.SinkRecord;
import com.whereq.vigil.model.TargetOutcome;
import com.whereq.vigil.sink.RecordSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Probes a batch of targets with bounded concurrency.
 *
 * <p>At most {@code concurrency} probes run at once on a dedicated worker pool, and every target
 * is probed exactly once. A probe that fails or exceeds its deadline marks only its own target
 * failed. Results are accounted for one at a time in completion order; targets with findings are
 * buffered and upserted into the sink every {@code batchSize} records, with the remainder written
 * at the end. A sink that rejects a batch fails the whole scan.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class ScanEngine {

    private final TimeoutGuardedExecutor executor;
    private final RecordSink sink;
    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter flushedCounter;

    public ScanEngine(TimeoutGuardedExecutor executor, RecordSink sink, MeterRegistry meterRegistry) {
        this.executor = executor;
        this.sink = sink;
        this.succeededCounter = Counter.builder("vigil.scan.probes")
            .tag("outcome", "success")
            .description("Scan targets probed successfully")
            .register(meterRegistry);
        this.failedCounter = Counter.builder("vigil.scan.probes")
            .tag("outcome", "failed")
            .description("Scan targets whose probe failed or timed out")
            .register(meterRegistry);
        this.flushedCounter = Counter.builder("vigil.scan.findings.flushed")
            .description("Target findings written to the sink")
            .register(meterRegistry);
    }

    /**
     * Probe every target and persist the findings.
     *
     * @throws SinkUnavailableException when a findings batch cannot be written
     */
    public ScanReport scan(List<ScanTarget> targets, TargetProbe probe, ScanOptions options) {
        ScanBatch batch = new ScanBatch(targets.size(), options.getCaptureTime(), options.getFailurePreview());
        ScanProgressReporter progress = new ScanProgressReporter(batch, options.getProgressEvery());

        if (targets.isEmpty()) {
            log.warn("No targets to scan");
            ScanReport report = batch.report();
            progress.summary(report);
            return report;
        }

        int concurrency = Math.max(1, Math.min(options.getConcurrency(), targets.size()));
        log.info("Scanning {} targets with {} concurrent workers", targets.size(), concurrency);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Scheduler workers = Schedulers.newBoundedElastic(concurrency, Integer.MAX_VALUE, "vigil-scan", 60, true);
        Disposable ticker = Flux.interval(options.getProgressInterval(), options.getProgressInterval())
            .subscribe(tick -> withMdc(mdc, progress::report));

        try {
            Flux.fromIterable(targets)
                .flatMap(target -> probeOne(target, probe, options, workers, mdc), concurrency)
                .doOnNext(result -> withMdc(mdc, () -> {
                    int completed = batch.record(result);
                    (result.isSuccess() ? succeededCounter : failedCounter).increment();
                    if (!result.isSuccess()) {
                        log.debug("Probe of {} failed: {}", result.getTarget().getAddress(), result.getError());
                    }
                    progress.onCompleted(completed);
                }))
                .filter(result -> result.isSuccess() && !result.getFindings().isEmpty())
                .map(result -> toRecord(result, batch.getCaptureTime()))
                .buffer(Math.max(1, options.getBatchSize()))
                .concatMap(records -> flush(options.getTable(), records, mdc))
                .doOnNext(batch::addPersisted)
                .blockLast();
        } finally {
            ticker.dispose();
            workers.dispose();
        }

        ScanReport report = batch.report();
        progress.summary(report);
        return report;
    }

    private Mono<ProbeResult> probeOne(ScanTarget target, TargetProbe probe, ScanOptions options,
                                       Scheduler workers, Map<String, String> mdc) {
        Callable<List<OpenPort>> task = () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return probe.probe(target);
            } finally {
                MDC.clear();
            }
        };

        return executor.guard("probe " + target.getAddress(),
                Mono.fromCallable(task).subscribeOn(workers),
                options.getProbeTimeout())
            .map(outcome -> toResult(target, outcome));
    }

    private Mono<Integer> flush(String table, List<SinkRecord> records, Map<String, String> mdc) {
        return sink.upsertBatch(table, records)
            .defaultIfEmpty(records.size())
            .doOnNext(count -> withMdc(mdc, () -> {
                flushedCounter.increment(count);
                log.info("Saved {} target findings to {}", count, table);
            }))
            .onErrorMap(e -> !(e instanceof SinkUnavailableException),
                e -> new SinkUnavailableException("Failed to save findings to " + table + ": " + e.getMessage(), e));
    }

    /**
     * Run on a Reactor thread with the caller's MDC, so the lines reach the job's log file.
     */
    private static void withMdc(Map<String, String> mdc, Runnable action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private static ProbeResult toResult(ScanTarget target, OperationOutcome<List<OpenPort>> outcome) {
        ProbeResult.ProbeResultBuilder result = ProbeResult.builder()
            .target(target)
            .elapsed(outcome.getElapsed());
        if (outcome.isSuccess()) {
            List<OpenPort> findings = outcome.getValue() != null ? outcome.getValue() : List.of();
            return result.outcome(TargetOutcome.SUCCESS).findings(findings).build();
        }
        return result
            .outcome(TargetOutcome.FAILED)
            .timedOut(outcome.isTimedOut())
            .error(outcome.getMessage())
            .build();
    }

    static SinkRecord toRecord(ProbeResult result, Instant captureTime) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("ipAddress", result.getTarget().getAddress());
        attributes.put("openPorts", result.getFindings().stream()
            .map(port -> Map.<String, Object>of(
                "port", port.getPort(),
                "protocol", port.getProtocol(),
                "service", port.getService()))
            .collect(Collectors.toList()));
        return SinkRecord.builder()
            .identity(result.getTarget().getIdentity())
            .capturedAt(captureTime)
            .attributes(attributes)
            .build();
    }
}
