package com.whereq.vigil.config;

import com.whereq.vigil.sink.InMemoryRecordSink;
import com.whereq.vigil.sink.RecordSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local record sink, for dry runs without Redis
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "vigil.sink", name = "type", havingValue = "memory")
public class InMemorySinkConfig {

    @Bean
    public RecordSink recordSink() {
        log.warn("Using the in-memory record sink, records are discarded on exit");
        return new InMemoryRecordSink();
    }
}
