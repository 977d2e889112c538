package com.whereq.vigil.scan;

import com.whereq.vigil.exception.SinkUnavailableException;
import com.whereq.vigil.executor.ManagedProcessRegistry;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import com.whereq.vigil.model.OpenPort;
import com.whereq.vigil.model.ProbeResult;
import com.whereq.vigil.model.ScanReport;
import com.whereq.vigil.model.ScanTarget;
import com.whereq.vigil.model.SinkRecord;
import com.whereq.vigil.sink.InMemoryRecordSink;
import com.whereq.vigil.sink.RecordSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanEngineTest {

    private final TimeoutGuardedExecutor executor = new TimeoutGuardedExecutor(new ManagedProcessRegistry(Duration.ofSeconds(1)));
    private final InMemoryRecordSink sink = new InMemoryRecordSink();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ScanEngine engine = new ScanEngine(executor, sink, meterRegistry);

    @Test
    void everyTargetIsProbedExactlyOnceWithBoundedConcurrency() {
        List<ScanTarget> targets = targets(40);
        Map<String, AtomicInteger> probes = new ConcurrentHashMap<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        ScanReport report = engine.scan(targets, target -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            probes.computeIfAbsent(target.getAddress(), a -> new AtomicInteger()).incrementAndGet();
            Thread.sleep((target.getAddress().hashCode() & 0x7) * 5L);
            inFlight.decrementAndGet();
            return List.of(OpenPort.builder().port(22).service("ssh").build());
        }, options(4, Duration.ofSeconds(5)));

        assertThat(report.getCompleted()).isEqualTo(40);
        assertThat(report.getSucceeded() + report.getFailed()).isEqualTo(40);
        assertThat(probes).hasSize(40);
        assertThat(probes.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(4);
        assertThat(report.getFindingsPersisted()).isEqualTo(40);
        assertThat(sink.count("ip_open_ports").block()).isEqualTo(40L);
    }

    @Test
    void hungTargetBecomesFailureWithoutStallingBatch() {
        List<ScanTarget> targets = List.of(
            new ScanTarget("10.0.0.1", "id-1"),
            new ScanTarget("10.0.0.2", "id-2"),
            new ScanTarget("10.0.0.3", "id-3"));

        ScanReport report = engine.scan(targets, target -> {
            if (target.getAddress().equals("10.0.0.2")) {
                Thread.sleep(10_000);
            }
            return List.of(OpenPort.builder().port(8899).service("solana-rpc").build());
        }, options(2, Duration.ofMillis(300)));

        assertThat(report.getCompleted()).isEqualTo(3);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getSucceeded()).isEqualTo(2);
        assertThat(report.getFindingsPersisted()).isEqualTo(2);
        assertThat(report.getElapsed()).isLessThan(Duration.ofSeconds(5));

        ProbeResult failure = report.getFailurePreview().get(0);
        assertThat(failure.getTarget().getAddress()).isEqualTo("10.0.0.2");
        assertThat(failure.isTimedOut()).isTrue();

        assertThat(sink.records("ip_open_ports"))
            .extracting(SinkRecord::getIdentity)
            .containsExactlyInAnyOrder("id-1", "id-3");
    }

    @Test
    void failingProbeDoesNotAbortBatch() {
        List<ScanTarget> targets = targets(10);

        ScanReport report = engine.scan(targets, target -> {
            if (target.getAddress().endsWith(".5")) {
                throw new IllegalStateException("unreachable");
            }
            return List.of();
        }, options(3, Duration.ofSeconds(5)));

        assertThat(report.getCompleted()).isEqualTo(10);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getFailurePreview()).extracting(ProbeResult::getError).containsExactly("unreachable");
        assertThat(report.getFindingsPersisted()).isZero();
        assertThat(meterRegistry.counter("vigil.scan.probes", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void findingsAreFlushedInBatches() {
        List<Integer> batchSizes = new ArrayList<>();
        RecordSink counting = new RecordSink() {
            @Override
            public Mono<Integer> upsertBatch(String table, List<SinkRecord> records) {
                synchronized (batchSizes) {
                    batchSizes.add(records.size());
                }
                return sink.upsertBatch(table, records);
            }

            @Override
            public Mono<Long> count(String table) {
                return sink.count(table);
            }
        };
        ScanEngine batching = new ScanEngine(executor, counting, meterRegistry);

        ScanReport report = batching.scan(targets(25),
            target -> List.of(OpenPort.builder().port(80).service("http").build()),
            options(5, Duration.ofSeconds(5)).toBuilder().batchSize(10).build());

        assertThat(batchSizes).containsExactly(10, 10, 5);
        assertThat(report.getFindingsPersisted()).isEqualTo(25);
    }

    @Test
    void failurePreviewIsBounded() {
        ScanReport report = engine.scan(targets(30), target -> {
            throw new IllegalStateException("down");
        }, options(8, Duration.ofSeconds(5)).toBuilder().failurePreview(10).build());

        assertThat(report.getFailed()).isEqualTo(30);
        assertThat(report.getFailurePreview()).hasSize(10);
    }

    @Test
    void unavailableSinkFailsTheScan() {
        RecordSink broken = new RecordSink() {
            @Override
            public Mono<Integer> upsertBatch(String table, List<SinkRecord> records) {
                return Mono.error(new IllegalStateException("connection refused"));
            }

            @Override
            public Mono<Long> count(String table) {
                return Mono.just(0L);
            }
        };
        ScanEngine failing = new ScanEngine(executor, broken, meterRegistry);

        assertThatThrownBy(() -> failing.scan(targets(5),
            target -> List.of(OpenPort.builder().port(22).build()),
            options(2, Duration.ofSeconds(5))))
            .isInstanceOf(SinkUnavailableException.class)
            .hasMessageContaining("connection refused");
    }

    @Test
    void emptyTargetListCompletesImmediately() {
        ScanReport report = engine.scan(List.of(), target -> List.of(), options(4, Duration.ofSeconds(1)));

        assertThat(report.getTotal()).isZero();
        assertThat(report.getCompleted()).isZero();
    }

    @Test
    void recordsShareTheBatchCaptureTime() {
        Instant captured = Instant.parse("2024-05-01T00:00:00Z");

        engine.scan(targets(3), target -> List.of(OpenPort.builder().port(22).build()),
            options(2, Duration.ofSeconds(5)).toBuilder().captureTime(captured).build());

        assertThat(sink.records("ip_open_ports"))
            .extracting(SinkRecord::getCapturedAt)
            .containsOnly(captured);
    }

    private static List<ScanTarget> targets(int count) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> new ScanTarget("10.0.0." + i, "id-" + i))
            .collect(Collectors.toList());
    }

    private static ScanOptions options(int concurrency, Duration probeTimeout) {
        return ScanOptions.builder()
            .table("ip_open_ports")
            .concurrency(concurrency)
            .probeTimeout(probeTimeout)
            .batchSize(100)
            .progressEvery(10)
            .progressInterval(Duration.ofSeconds(30))
            .failurePreview(10)
            .build();
    }
}
