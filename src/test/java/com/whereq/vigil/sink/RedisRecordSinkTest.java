package com.whereq.vigil.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.exception.SinkUnavailableException;
import com.whereq.vigil.model.SinkRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveSetOperations;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisRecordSinkTest {

    private static final Instant CAPTURED = Instant.parse("2024-05-01T12:00:00Z");

    @SuppressWarnings("unchecked")
    private final ReactiveRedisTemplate<String, String> template = mock(ReactiveRedisTemplate.class);
    @SuppressWarnings("unchecked")
    private final ReactiveValueOperations<String, String> values = mock(ReactiveValueOperations.class);
    @SuppressWarnings("unchecked")
    private final ReactiveSetOperations<String, String> sets = mock(ReactiveSetOperations.class);

    private RedisRecordSink sink;

    @BeforeEach
    void setUp() {
        when(template.opsForValue()).thenReturn(values);
        when(template.opsForSet()).thenReturn(sets);
        sink = new RedisRecordSink(template, new ObjectMapper().findAndRegisterModules(), "vigil", Duration.ofSeconds(5));
    }

    @Test
    void recordsAreKeyedByIdentityAndCaptureTime() {
        when(values.set(anyString(), anyString())).thenReturn(Mono.just(true));
        when(sets.add(anyString(), anyString())).thenReturn(Mono.just(1L));

        StepVerifier.create(sink.upsertBatch("ip_open_ports", List.of(record("A"))))
            .expectNext(1)
            .verifyComplete();

        String key = "vigil:ip_open_ports:A:" + CAPTURED.toEpochMilli();
        verify(values).set(eq(key), anyString());
        verify(sets).add("vigil:ip_open_ports:index", key);
    }

    @Test
    void redisErrorBecomesSinkUnavailable() {
        when(values.set(anyString(), anyString()))
            .thenReturn(Mono.error(new RedisConnectionFailureException("Unable to connect to Redis")));

        StepVerifier.create(sink.upsertBatch("ip_open_ports", List.of(record("A"))))
            .expectError(SinkUnavailableException.class)
            .verify();
    }

    private static SinkRecord record(String identity) {
        return SinkRecord.builder()
            .identity(identity)
            .capturedAt(CAPTURED)
            .attributes(Map.of("ipAddress", "10.0.0.1"))
            .build();
    }
}
