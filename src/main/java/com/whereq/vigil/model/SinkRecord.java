package com.whereq.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One row handed to the external sink, keyed by (identity, capture time)
 */
@Value
@Builder
public class SinkRecord {
    String identity;
    Instant capturedAt;
    Map<String, Object> attributes;

    public String key() {
        return identity + "@" + capturedAt.toEpochMilli();
    }
}
