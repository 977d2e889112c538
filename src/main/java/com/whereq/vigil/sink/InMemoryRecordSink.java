package com.whereq.vigil.sink;

import com.whereq.vigil.model.SinkRecord;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Record sink kept in process memory, for dry runs and tests.
 */
@Slf4j
public class InMemoryRecordSink implements RecordSink {

    private final Map<String, Map<String, SinkRecord>> tables = new ConcurrentHashMap<>();

    @Override
    public Mono<Integer> upsertBatch(String table, List<SinkRecord> records) {
        return Mono.fromCallable(() -> {
            Map<String, SinkRecord> rows = tables.computeIfAbsent(table, t -> new ConcurrentHashMap<>());
            records.forEach(record -> rows.put(record.key(), record));
            log.debug("Upserted {} records into {}", records.size(), table);
            return records.size();
        });
    }

    @Override
    public Mono<Long> count(String table) {
        return Mono.fromSupplier(() -> (long) tables.getOrDefault(table, Map.of()).size());
    }

    public List<SinkRecord> records(String table) {
        return tables.getOrDefault(table, Map.of()).values().stream()
            .sorted((a, b) -> a.key().compareTo(b.key()))
            .collect(Collectors.toList());
    }
}
