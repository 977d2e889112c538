package com.whereq.vigil.executor;

import com.whereq.vigil.config.VigilProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tracks external processes started on behalf of jobs so they can be terminated
 * on deadline or shutdown, escalating to a forcible kill after a grace period.
 */
@Slf4j
@Component
public class ManagedProcessRegistry {

    /**
     * How long a killed process tree gets to disappear.
     */
    static final Duration KILL_WAIT = Duration.ofSeconds(2);

    private final Set<Process> running = ConcurrentHashMap.newKeySet();
    private final Duration grace;

    @Autowired
    public ManagedProcessRegistry(VigilProperties properties) {
        this(properties.getShutdownGrace());
    }

    public ManagedProcessRegistry(Duration grace) {
        this.grace = grace;
    }

    public void register(Process process) {
        running.add(process);
    }

    public void unregister(Process process) {
        running.remove(process);
    }

    public int size() {
        return running.size();
    }

    public Duration getGrace() {
        return grace;
    }

    /**
     * Ask the process and its descendants to exit, kill them if they are still alive after the grace period.
     * Returns once the whole tree has exited or the kill wait ran out.
     */
    public void terminate(Process process) {
        List<ProcessHandle> tree = process.descendants().collect(Collectors.toList());
        if (!process.isAlive() && tree.isEmpty()) {
            return;
        }
        tree.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!awaitExit(process, tree, grace)) {
                log.warn("Process {} ignored termination for {}s, killing it", process.pid(), grace.toSeconds());
                kill(process, tree);
            }
        } catch (InterruptedException e) {
            kill(process, tree);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Kill the process and its descendants without a grace period.
     */
    public void kill(Process process) {
        kill(process, process.descendants().collect(Collectors.toList()));
    }

    private void kill(Process process, List<ProcessHandle> tree) {
        tree.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();

        boolean interrupted = Thread.interrupted();
        try {
            if (!awaitExit(process, tree, KILL_WAIT)) {
                log.error("Process {} or one of its children is still alive after SIGKILL", process.pid());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean awaitExit(Process process, List<ProcessHandle> tree, Duration timeout)
            throws InterruptedException {
        CompletableFuture<?>[] exits = Stream.concat(Stream.of(process.toHandle()), tree.stream())
            .map(ProcessHandle::onExit)
            .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.warn("Cannot observe exit of process {}: {}", process.pid(), e.getCause().getMessage());
            return !process.isAlive();
        }
    }

    /**
     * Terminate every process still running.
     */
    public void terminateAll() {
        if (running.isEmpty()) {
            return;
        }
        log.info("Terminating {} managed processes", running.size());
        for (Process process : Set.copyOf(running)) {
            terminate(process);
            running.remove(process);
        }
    }
}
