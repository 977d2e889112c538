package com.whereq.vigil.service;

import com.whereq.vigil.executor.ManagedProcessRegistry;
import com.whereq.vigil.lock.JobLockManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orderly shutdown on a termination signal: stop scheduling, terminate managed processes
 * (forcibly after the grace period), then release every lock this process still holds.
 */
@Slf4j
@Component
public class ShutdownCoordinator {

    private final JobScheduler scheduler;
    private final ManagedProcessRegistry processes;
    private final JobLockManager lockManager;

    public ShutdownCoordinator(JobScheduler scheduler, ManagedProcessRegistry processes, JobLockManager lockManager) {
        this.scheduler = scheduler;
        this.processes = processes;
        this.lockManager = lockManager;
    }

    @PreDestroy
    public void onShutdown() {
        log.debug("Shutting down, {} managed process(es) alive", processes.size());
        scheduler.cancelInFlight();
        processes.terminateAll();
        lockManager.releaseAll();
    }
}
