package com.whereq.vigil.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.model.SinkRecord;
import com.whereq.vigil.sink.InMemoryRecordSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotUpsertStepTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryRecordSink sink = new InMemoryRecordSink();

    @Test
    void upsertsCompleteRecordsOnly() throws Exception {
        Path snapshot = Files.writeString(dir.resolve("gossip_data.json"), "["
            + "{\"identityPubkey\":\"A\",\"ipAddress\":\"10.0.0.1\",\"version\":\"1.18.0\"},"
            + "{\"identityPubkey\":\"B\",\"ipAddress\":null,\"version\":\"1.18.0\"},"
            + "{\"identityPubkey\":\"C\",\"ipAddress\":\"10.0.0.3\",\"version\":\"1.18.1\"},"
            + "{\"ipAddress\":\"10.0.0.4\",\"version\":\"1.18.1\"}"
            + "]");
        SnapshotUpsertStep step = step(snapshot, null, List.of("ipAddress", "version"), 1);

        RunContext context = RunContext.root(null).forJob("gossip").withSnapshot(snapshot);
        step.process(context);

        List<SinkRecord> records = sink.records("gossip_peers");
        assertThat(records).extracting(SinkRecord::getIdentity).containsExactlyInAnyOrder("A", "C");
        assertThat(records).allSatisfy(record -> {
            assertThat(record.getCapturedAt()).isEqualTo(context.getStartedAt());
            assertThat(record.getAttributes()).containsKey("version");
        });
    }

    @Test
    void readsRecordsUnderPathAndIsIdempotentPerRun() throws Exception {
        Path snapshot = Files.writeString(dir.resolve("validators_data.json"),
            "{\"validators\":[{\"identityPubkey\":\"A\",\"activatedStake\":10},{\"identityPubkey\":\"B\",\"activatedStake\":5}]}");
        SnapshotUpsertStep step = step(snapshot, "validators", List.of(), 500);
        RunContext context = RunContext.root(null).forJob("validators");

        step.process(context);
        step.process(context);

        assertThat(sink.count("gossip_peers").block()).isEqualTo(2L);
    }

    private SnapshotUpsertStep step(Path snapshot, String recordsPath, List<String> required, int batchSize) {
        return SnapshotUpsertStep.builder()
            .table("gossip_peers")
            .identityField("identityPubkey")
            .recordsPath(recordsPath)
            .requiredFields(required)
            .batchSize(batchSize)
            .defaultSnapshot(snapshot)
            .store(new SnapshotStore(objectMapper, 10))
            .sink(sink)
            .objectMapper(objectMapper)
            .build();
    }
}
