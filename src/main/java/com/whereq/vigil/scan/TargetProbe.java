package com.whereq.vigil.scan;

import com.whereq.vigil.model.OpenPort;
import com.whereq.vigil.model.ScanTarget;

import java.util.List;

/**
 * One blocking probe of one host. Implementations must be thread-safe and should stop
 * promptly when their thread is interrupted.
 */
@FunctionalInterface
public interface TargetProbe {

    /**
     * @return findings for the target, empty when nothing was found
     * @throws Exception when the target could not be probed
     */
    List<OpenPort> probe(ScanTarget target) throws Exception;
}
