package com.whereq.vigil.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whereq.vigil.exception.SinkUnavailableException;
import com.whereq.vigil.model.SinkRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record sink backed by Redis.
 *
 * <p>Each record is stored as a JSON string under {@code <prefix>:<table>:<identity>:<epoch-millis>},
 * and its key is added to the {@code <prefix>:<table>:index} set. SET and SADD are both
 * idempotent, so replaying a batch does not duplicate rows.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class RedisRecordSink implements RecordSink {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration writeTimeout;

    public RedisRecordSink(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                           String keyPrefix, Duration writeTimeout) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.keyPrefix = keyPrefix;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public Mono<Integer> upsertBatch(String table, List<SinkRecord> records) {
        String indexKey = indexKey(table);
        return Flux.fromIterable(records)
            .concatMap(record -> {
                String key = recordKey(table, record);
                return redisTemplate.opsForValue().set(key, toJson(record))
                    .then(Mono.defer(() -> redisTemplate.opsForSet().add(indexKey, key)));
            })
            .then(Mono.just(records.size()))
            .timeout(writeTimeout)
            .doOnSuccess(count -> log.debug("Upserted {} records into {}", count, indexKey))
            .onErrorMap(e -> !(e instanceof SinkUnavailableException),
                e -> new SinkUnavailableException("Redis rejected batch for " + table + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<Long> count(String table) {
        return redisTemplate.opsForSet().size(indexKey(table))
            .defaultIfEmpty(0L)
            .onErrorMap(e -> new SinkUnavailableException("Redis unavailable: " + e.getMessage(), e));
    }

    String recordKey(String table, SinkRecord record) {
        return keyPrefix + ":" + table + ":" + record.getIdentity() + ":" + record.getCapturedAt().toEpochMilli();
    }

    private String indexKey(String table) {
        return keyPrefix + ":" + table + ":index";
    }

    private String toJson(SinkRecord record) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("identity", record.getIdentity());
        document.put("capturedAt", record.getCapturedAt());
        document.put("attributes", record.getAttributes());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SinkUnavailableException("Failed to serialize record " + record.key(), e);
        }
    }
}
