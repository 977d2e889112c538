package com.whereq.vigil.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.sink.RecordSink;
import com.whereq.vigil.sink.RedisRecordSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the record sink
 */
@Configuration
@ConditionalOnProperty(prefix = "vigil.sink", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {

        RedisSerializationContext<String, String> serializationContext =
            RedisSerializationContext.<String, String>newSerializationContext(new StringRedisSerializer())
                .value(new StringRedisSerializer())
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }

    @Bean
    public RecordSink recordSink(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                 ObjectMapper objectMapper, VigilProperties properties) {
        VigilProperties.SinkConfig sink = properties.getSink();
        return new RedisRecordSink(reactiveRedisTemplate, objectMapper, sink.getKeyPrefix(), sink.getWriteTimeout());
    }
}
