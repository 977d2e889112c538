package com.whereq.vigil.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A port found open on a probed host
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenPort {
    private int port;

    @Builder.Default
    private String protocol = "tcp";

    @Builder.Default
    private String service = "unknown";
}
