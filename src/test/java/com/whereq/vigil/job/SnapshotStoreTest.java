package com.whereq.vigil.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.exception.FetchInvalidException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotStoreTest {

    private static final String PRIOR = "[{\"identityPubkey\":\"prior\",\"ipAddress\":\"10.0.0.9\"}]";

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SnapshotStore store = new SnapshotStore(objectMapper, 10);

    @Test
    void tooSmallOutputLeavesPriorSnapshotUntouched() throws Exception {
        Path snapshot = priorSnapshot();
        byte[] before = Files.readAllBytes(snapshot);
        Path staged = Files.writeString(store.stagingPath(snapshot), "[]");

        assertThatThrownBy(() -> store.commit(staged, snapshot))
            .isInstanceOf(FetchInvalidException.class)
            .hasMessageContaining("too small");

        assertThat(Files.readAllBytes(snapshot)).isEqualTo(before);
    }

    @Test
    void sizeAtThresholdIsRejected() throws Exception {
        Path snapshot = priorSnapshot();
        // exactly 10 bytes
        Path staged = Files.writeString(store.stagingPath(snapshot), "[1,2,3,45]");

        assertThatThrownBy(() -> store.commit(staged, snapshot)).isInstanceOf(FetchInvalidException.class);
        assertThat(Files.readString(snapshot)).isEqualTo(PRIOR);
    }

    @Test
    void malformedOutputLeavesPriorSnapshotUntouched() throws Exception {
        Path snapshot = priorSnapshot();
        Path staged = Files.writeString(store.stagingPath(snapshot), "[{\"identityPubkey\": \"truncated\"");

        assertThatThrownBy(() -> store.commit(staged, snapshot))
            .isInstanceOf(FetchInvalidException.class)
            .hasMessageContaining("Invalid JSON");

        assertThat(Files.readString(snapshot)).isEqualTo(PRIOR);
    }

    @Test
    void trailingGarbageIsRejected() throws Exception {
        Path snapshot = priorSnapshot();
        Path staged = Files.writeString(store.stagingPath(snapshot), "{\"a\":\"b\"} Error: rpc unavailable");

        assertThatThrownBy(() -> store.commit(staged, snapshot)).isInstanceOf(FetchInvalidException.class);
        assertThat(Files.readString(snapshot)).isEqualTo(PRIOR);
    }

    @Test
    void validOutputReplacesSnapshot() throws Exception {
        Path snapshot = priorSnapshot();
        String fresh = "[{\"identityPubkey\":\"fresh\",\"ipAddress\":\"10.0.0.1\"}]";
        Path staged = Files.writeString(store.stagingPath(snapshot), fresh);

        Path committed = store.commit(staged, snapshot);

        assertThat(committed).isEqualTo(snapshot);
        assertThat(Files.readString(snapshot)).isEqualTo(fresh);
        assertThat(staged).doesNotExist();
    }

    @Test
    void recordsAreFoundAtTopLevelOrUnderPath() throws Exception {
        JsonNode array = objectMapper.readTree("[{\"a\":1},{\"a\":2}]");
        JsonNode nested = objectMapper.readTree("{\"validators\":[{\"a\":1}],\"total\":1}");
        JsonNode single = objectMapper.readTree("{\"a\":1}");

        assertThat(SnapshotStore.records(array, null)).hasSize(2);
        assertThat(SnapshotStore.records(nested, "validators")).hasSize(1);
        assertThat(SnapshotStore.records(single, null)).hasSize(1);
        assertThat(SnapshotStore.records(nested, "missing")).isEqualTo(List.of());
    }

    private Path priorSnapshot() throws Exception {
        return Files.writeString(dir.resolve("gossip_data.json"), PRIOR);
    }
}
