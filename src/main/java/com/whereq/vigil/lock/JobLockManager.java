package com.whereq.vigil.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.exception.JobAlreadyRunningException;
import com.whereq.vigil.model.LockMarker;
import com.whereq.vigil.model.LockState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-job mutual exclusion through marker files in a shared lock directory.
 *
 * <p>A marker records its holder (host, pid, holder id) and a heartbeat timestamp that is
 * refreshed while the lock is held. A marker is stale when its holder process is gone
 * (checked when the holder runs on this host) or its heartbeat is older than the configured
 * threshold; stale markers are reclaimed with a warning. Every change to a marker happens under
 * the job's guard file lock, so two processes reclaiming the same stale marker cannot both win.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class JobLockManager {

    private static final String MARKER_SUFFIX = ".lock";
    private static final String GUARD_SUFFIX = ".lock.guard";

    /**
     * File locks are held per JVM, so managers sharing a lock directory in one process
     * also serialize on a monitor per guard file.
     */
    private static final Map<Path, Object> GUARDS = new ConcurrentHashMap<>();

    private final Path lockDir;
    private final Duration heartbeatInterval;
    private final Duration staleAfter;
    private final ObjectMapper objectMapper;
    private final String host;
    private final long pid;

    private final Map<String, LockHandle> held = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeats;

    @Autowired
    public JobLockManager(VigilProperties properties, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this(properties.resolveLockDir(),
            properties.getLock().getHeartbeatInterval(),
            properties.getLock().getStaleAfter(),
            objectMapper);

        Gauge.builder("vigil.locks.held", held, Map::size)
            .description("Job locks held by this process")
            .register(meterRegistry);
    }

    public JobLockManager(Path lockDir, Duration heartbeatInterval, Duration staleAfter, ObjectMapper objectMapper) {
        this.lockDir = lockDir;
        this.heartbeatInterval = heartbeatInterval;
        this.staleAfter = staleAfter;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.host = localHostName();
        this.pid = ProcessHandle.current().pid();
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vigil-lock-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Acquire the lock of a job.
     *
     * @param jobName job to lock
     * @return handle whose release deletes the marker
     * @throws JobAlreadyRunningException if a live holder owns the marker
     */
    public LockHandle acquire(String jobName) {
        Path marker = markerPath(jobName);
        LockHandle handle = guarded(jobName, () -> {
            LockState state = inspect(jobName);
            if (state.getKind() == LockState.Kind.HELD) {
                throw new JobAlreadyRunningException(jobName, holderOf(state));
            }
            if (state.getKind() == LockState.Kind.STALE) {
                log.warn("Removing stale lock for {} (holder {}, last heartbeat {}s ago)",
                    jobName, holderOf(state), state.getHeartbeatAge().toSeconds());
                deleteMarker(marker);
            }

            Instant now = Instant.now();
            LockMarker content = LockMarker.builder()
                .jobName(jobName)
                .holderId(newHolderId())
                .host(host)
                .pid(pid)
                .acquiredAt(now)
                .heartbeatAt(now)
                .build();

            try {
                Files.write(marker, objectMapper.writeValueAsBytes(content),
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                // a holder that does not take the guard got in first
                throw new JobAlreadyRunningException(jobName, holderOf(inspect(jobName)));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write lock marker " + marker, e);
            }
            return new LockHandle(this, jobName, content.getHolderId(), marker, now);
        });

        held.put(jobName, handle);
        handle.attachHeartbeat(heartbeats.scheduleAtFixedRate(() -> heartbeat(handle),
            heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS));

        log.info("Acquired lock for {} (holder {}, pid {})", jobName, handle.getHolderId(), pid);
        return handle;
    }

    /**
     * Observe a job's marker without changing it.
     */
    public LockState inspect(String jobName) {
        Path marker = markerPath(jobName);
        if (!Files.exists(marker)) {
            return LockState.free(jobName);
        }

        Optional<LockMarker> content = readMarker(marker);
        Instant heartbeatAt = content.map(LockMarker::getHeartbeatAt)
            .orElseGet(() -> lastModified(marker));
        if (heartbeatAt == null) {
            // vanished between the exists check and the read
            return LockState.free(jobName);
        }

        Duration age = Duration.between(heartbeatAt, Instant.now());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }

        boolean holderGone = content
            .filter(m -> host.equals(m.getHost()) && m.getPid() > 0)
            .map(m -> !isProcessAlive(m.getPid()))
            .orElse(false);

        LockState.Kind kind = holderGone || age.compareTo(staleAfter) > 0 ? LockState.Kind.STALE : LockState.Kind.HELD;
        return new LockState(jobName, kind, content.orElse(null), age);
    }

    public List<LockState> inspectAll(Iterable<String> jobNames) {
        List<LockState> states = new ArrayList<>();
        jobNames.forEach(name -> states.add(inspect(name)));
        return states;
    }

    /**
     * Delete a job's marker whoever holds it. Used by the stop command after the holder was terminated.
     */
    public void forceRemove(String jobName) {
        guarded(jobName, () -> {
            deleteMarker(markerPath(jobName));
            return null;
        });
    }

    /**
     * True if the marker's holder runs on this host.
     */
    public boolean isLocal(LockMarker marker) {
        return marker != null && host.equals(marker.getHost());
    }

    public boolean isHeldHere(String jobName) {
        return held.containsKey(jobName);
    }

    public Path markerPath(String jobName) {
        return lockDir.resolve(jobName + MARKER_SUFFIX);
    }

    void release(LockHandle handle) {
        handle.cancelHeartbeat();
        held.remove(handle.getJobName(), handle);

        Path marker = handle.getMarker();
        boolean deleted = guarded(handle.getJobName(), () -> {
            Optional<LockMarker> current = readMarker(marker);
            if (current.isPresent() && !handle.getHolderId().equals(current.get().getHolderId())) {
                log.warn("Lock marker for {} now belongs to {}, leaving it in place",
                    handle.getJobName(), current.get().getHolderId());
                return false;
            }
            deleteMarker(marker);
            return true;
        });
        if (deleted) {
            log.info("Released lock for {}", handle.getJobName());
        }
    }

    /**
     * Release every lock this process holds.
     */
    public void releaseAll() {
        for (LockHandle handle : List.copyOf(held.values())) {
            handle.release();
        }
    }

    @PreDestroy
    public void shutdown() {
        releaseAll();
        heartbeats.shutdownNow();
    }

    private void heartbeat(LockHandle handle) {
        if (handle.isReleased()) {
            handle.cancelHeartbeat();
            return;
        }
        try {
            guarded(handle.getJobName(), () -> {
                refreshHeartbeat(handle);
                return null;
            });
        } catch (UncheckedIOException e) {
            log.warn("Failed to refresh heartbeat for {}: {}", handle.getJobName(), e.getMessage());
        }
    }

    private void refreshHeartbeat(LockHandle handle) {
        Path marker = handle.getMarker();
        Optional<LockMarker> current = readMarker(marker);
        if (current.isEmpty() || !handle.getHolderId().equals(current.get().getHolderId())) {
            log.error("Lock marker for {} was removed or taken over, stopping heartbeat", handle.getJobName());
            handle.cancelHeartbeat();
            return;
        }
        LockMarker refreshed = current.get().toBuilder().heartbeatAt(Instant.now()).build();
        Path temp = marker.resolveSibling(marker.getFileName() + "." + handle.getHolderId() + ".tmp");
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(refreshed));
            Files.move(temp, marker, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("Heartbeat refreshed for {}", handle.getJobName());
        } catch (IOException e) {
            log.warn("Failed to refresh heartbeat for {}: {}", handle.getJobName(), e.getMessage());
            deleteMarker(temp);
        }
    }

    /**
     * Run a marker mutation while holding the job's guard: an in-process monitor plus an exclusive
     * file lock on {@code <job>.lock.guard}, so inspect-then-replace is atomic across processes.
     * The caller's interrupt status is set aside while the guard is held.
     */
    private <T> T guarded(String jobName, Supplier<T> action) {
        createLockDir();
        Path guard = lockDir.resolve(jobName + GUARD_SUFFIX);
        Object monitor = GUARDS.computeIfAbsent(guard.toAbsolutePath().normalize(), key -> new Object());
        boolean interrupted = Thread.interrupted();
        try {
            synchronized (monitor) {
                try (FileChannel channel = FileChannel.open(guard, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    return action.get();
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot lock guard file " + guard, e);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Optional<LockMarker> readMarker(Path marker) {
        try {
            byte[] bytes = Files.readAllBytes(marker);
            if (bytes.length == 0) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(bytes, LockMarker.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable lock marker {}: {}", marker, e.getMessage());
            return Optional.empty();
        }
    }

    private Instant lastModified(Path marker) {
        try {
            return Files.getLastModifiedTime(marker).toInstant();
        } catch (IOException e) {
            return null;
        }
    }

    private void deleteMarker(Path marker) {
        try {
            Files.deleteIfExists(marker);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete lock marker " + marker, e);
        }
    }

    private void createLockDir() {
        try {
            Files.createDirectories(lockDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create lock directory " + lockDir, e);
        }
    }

    private static boolean isProcessAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static String holderOf(LockState state) {
        return state.getMarker() != null ? state.getMarker().getHolderId() : "unknown";
    }

    private String newHolderId() {
        return host + "-" + pid + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }
}
