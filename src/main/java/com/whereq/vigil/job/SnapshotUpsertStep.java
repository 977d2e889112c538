package com.whereq.vigil.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.model.SinkRecord;
import com.whereq.vigil.sink.RecordSink;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Upserts every record of the job's snapshot into a sink table, keyed by
 * (identity, run start time). Records lacking the identity or a required field are skipped.
 */
@Slf4j
@Builder
public class SnapshotUpsertStep implements ProcessStep {

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() { };

    private final String table;
    private final String identityField;
    private final String recordsPath;
    private final List<String> requiredFields;
    private final int batchSize;
    private final Path defaultSnapshot;
    private final SnapshotStore store;
    private final RecordSink sink;
    private final ObjectMapper objectMapper;

    @Override
    public void process(RunContext context) {
        Path snapshot = context.getSnapshot() != null ? context.getSnapshot() : defaultSnapshot;
        List<JsonNode> elements = SnapshotStore.records(store.read(snapshot), recordsPath);
        Instant capturedAt = context.getStartedAt();

        List<SinkRecord> records = new ArrayList<>(elements.size());
        int skipped = 0;
        for (JsonNode element : elements) {
            if (!isComplete(element)) {
                skipped++;
                continue;
            }
            records.add(SinkRecord.builder()
                .identity(element.get(identityField).asText())
                .capturedAt(capturedAt)
                .attributes(objectMapper.convertValue(element, ATTRIBUTES))
                .build());
        }
        if (skipped > 0) {
            log.warn("Skipped {} of {} records without {} or {}", skipped, elements.size(), identityField, requiredFields);
        }

        Integer written = Flux.fromIterable(records)
            .buffer(Math.max(1, batchSize))
            .concatMap(batch -> sink.upsertBatch(table, batch))
            .reduce(0, Integer::sum)
            .block();
        log.info("Saved {} records from {} to {}", written, snapshot.getFileName(), table);
    }

    private boolean isComplete(JsonNode element) {
        if (!hasValue(element, identityField)) {
            return false;
        }
        return requiredFields.stream().allMatch(field -> hasValue(element, field));
    }

    private static boolean hasValue(JsonNode element, String field) {
        JsonNode value = element.get(field);
        return value != null && !value.isNull() && !(value.isTextual() && value.asText().isBlank());
    }
}
