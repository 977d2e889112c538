package com.whereq.vigil.model;

import lombok.Value;

/**
 * One host subjected to one probe operation
 */
@Value
public class ScanTarget {
    /**
     * Network address of the host
     */
    String address;

    /**
     * Stable identity of the host owner, used as the sink key
     */
    String identity;
}
