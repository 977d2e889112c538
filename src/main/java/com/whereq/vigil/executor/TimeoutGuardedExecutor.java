package com.whereq.vigil.executor;

import com.whereq.vigil.exception.OperationFailedException;
import com.whereq.vigil.exception.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one external operation under a deadline and reports success, failure or timeout.
 * A timed out operation is cancelled (in-JVM) or terminated (external process); nothing is retried.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class TimeoutGuardedExecutor {

    /**
     * Exit code conventionally used by shells for "command not found".
     */
    static final int COMMAND_NOT_FOUND_EXIT_CODE = 127;

    private static final int OUTPUT_LIMIT_BYTES = 64 * 1024;
    private static final int ERROR_TAIL_CHARS = 2000;

    private final ManagedProcessRegistry processes;

    public TimeoutGuardedExecutor(ManagedProcessRegistry processes) {
        this.processes = processes;
    }

    /**
     * Guard a reactive operation. The returned Mono never errors: every failure is folded into the outcome.
     *
     * @param label     operation name used in messages
     * @param operation the operation, subscribed to once
     * @param deadline  maximum time to wait for the operation's value
     * @return Mono of the outcome
     */
    public <T> Mono<OperationOutcome<T>> guard(String label, Mono<T> operation, Duration deadline) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return operation
                .timeout(deadline)
                .map(value -> OperationOutcome.success(value, since(start)))
                .switchIfEmpty(Mono.fromSupplier(() -> OperationOutcome.<T>success(null, since(start))))
                .onErrorResume(error -> Mono.just(this.<T>classify(label, deadline, error, since(start))));
        });
    }

    /**
     * Run a blocking in-JVM operation on a worker thread and wait at most {@code deadline} for it.
     * On timeout the worker is interrupted and this call returns only after the worker has finished,
     * so processes it started are gone before the caller releases anything the operation held.
     */
    public <T> OperationOutcome<T> call(String label, Callable<T> operation, Duration deadline) {
        long start = System.nanoTime();
        JoinableTask<T> task = new JoinableTask<>(operation);
        OperationOutcome<T> outcome;
        try {
            outcome = guard(label,
                    Mono.fromCallable(task).subscribeOn(Schedulers.boundedElastic()),
                    deadline)
                .block();
        } catch (RuntimeException e) {
            // block() only throws when the waiting thread itself is interrupted
            log.warn("{} cancelled while waiting: {}", label, e.getMessage());
            outcome = OperationOutcome.failure(OperationOutcome.FAILURE_EXIT_CODE, label + " cancelled", since(start));
        }

        if (outcome == null) {
            return OperationOutcome.success(null, since(start));
        }
        if (!outcome.isSuccess()) {
            Duration joinTimeout = processes.getGrace().plus(ManagedProcessRegistry.KILL_WAIT);
            if (!task.cancelAndJoin(joinTimeout)) {
                log.error("{} is still running {}s after it was cancelled", label, joinTimeout.toSeconds());
            }
        }
        return outcome;
    }

    /**
     * Run an external program, terminating it (politely, then forcibly) when the deadline elapses.
     * A program exiting with 124 is itself reported as a timeout.
     *
     * @return outcome whose value is the captured stdout, or null when stdout went to {@link CommandSpec#getStdout()}
     */
    public OperationOutcome<String> runCommand(CommandSpec spec, Duration deadline) {
        long start = System.nanoTime();
        Path stdout = null;
        Path stderr = null;
        boolean captureStdout = spec.getStdout() == null;

        try {
            stdout = captureStdout ? Files.createTempFile("vigil-", ".out") : spec.getStdout();
            stderr = Files.createTempFile("vigil-", ".err");

            ProcessBuilder processBuilder = new ProcessBuilder(spec.getCommand());
            if (spec.getWorkingDir() != null) {
                processBuilder.directory(spec.getWorkingDir().toFile());
            }
            processBuilder.environment().putAll(spec.getEnvironment());
            processBuilder.redirectOutput(stdout.toFile());
            processBuilder.redirectError(stderr.toFile());

            log.info("Executing: {}", spec.describe());

            Process process;
            try {
                process = processBuilder.start();
            } catch (IOException e) {
                log.error("Could not start {}: {}", spec.describe(), e.getMessage());
                return OperationOutcome.failure(COMMAND_NOT_FOUND_EXIT_CODE,
                    "Could not start " + spec.getCommand().get(0) + ": " + e.getMessage(), since(start));
            }

            processes.register(process);
            try {
                boolean completed = process.waitFor(deadline.toMillis(), TimeUnit.MILLISECONDS);
                if (!completed) {
                    log.warn("{} exceeded {}s, terminating process {}", spec.describe(), deadline.toSeconds(), process.pid());
                    processes.terminate(process);
                    return OperationOutcome.timedOut(
                        spec.describe() + " timed out after " + deadline.toSeconds() + "s", since(start));
                }
            } catch (InterruptedException e) {
                processes.kill(process);
                Thread.currentThread().interrupt();
                return OperationOutcome.failure(OperationOutcome.FAILURE_EXIT_CODE,
                    spec.describe() + " interrupted", since(start));
            } finally {
                processes.unregister(process);
            }

            int exitCode = process.exitValue();
            if (exitCode == OperationOutcome.TIMEOUT_EXIT_CODE) {
                return OperationOutcome.timedOut(spec.describe() + " reported a timeout (exit code 124)", since(start));
            }
            if (exitCode != 0) {
                String errors = tail(stderr);
                log.debug("{} stderr: {}", spec.describe(), errors);
                return OperationOutcome.failure(exitCode,
                    spec.describe() + " failed with exit code " + exitCode + (errors.isEmpty() ? "" : ": " + errors),
                    since(start));
            }

            String output = captureStdout ? head(stdout) : null;
            return OperationOutcome.success(output, since(start));

        } catch (IOException e) {
            return OperationOutcome.failure(OperationOutcome.FAILURE_EXIT_CODE,
                "I/O error running " + spec.describe() + ": " + e.getMessage(), since(start));
        } finally {
            deleteQuietly(stderr);
            if (captureStdout) {
                deleteQuietly(stdout);
            }
        }
    }

    private <T> OperationOutcome<T> classify(String label, Duration deadline, Throwable error, Duration elapsed) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof TimeoutException) {
            return OperationOutcome.timedOut(label + " timed out after " + deadline.toMillis() + "ms", elapsed);
        }
        if (cause instanceof OperationTimeoutException) {
            return OperationOutcome.timedOut(cause.getMessage(), elapsed);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.debug("{} failed", label, cause);
        int exitCode = cause instanceof OperationFailedException failed
            ? failed.getExitCode()
            : OperationOutcome.FAILURE_EXIT_CODE;
        return OperationOutcome.failure(exitCode, message, elapsed);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String head(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] bytes = in.readNBytes(OUTPUT_LIMIT_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static String tail(Path file) {
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
            return content.length() > ERROR_TAIL_CHARS
                ? content.substring(content.length() - ERROR_TAIL_CHARS)
                : content;
        } catch (IOException e) {
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", file, e);
        }
    }

    /**
     * Callable whose worker thread can be interrupted and awaited once the caller gave up on it.
     */
    private static final class JoinableTask<T> implements Callable<T> {

        private final Callable<T> operation;
        private final CountDownLatch finished = new CountDownLatch(1);
        private Thread worker;
        private boolean cancelled;
        private boolean started;

        JoinableTask(Callable<T> operation) {
            this.operation = operation;
        }

        @Override
        public T call() throws Exception {
            synchronized (this) {
                if (cancelled) {
                    return null;
                }
                started = true;
                worker = Thread.currentThread();
            }
            try {
                return operation.call();
            } catch (Exception e) {
                if (isCancelled()) {
                    // nobody is waiting for the result any more
                    log.debug("Cancelled operation ended with {}", e.toString());
                    return null;
                }
                throw e;
            } finally {
                synchronized (this) {
                    worker = null;
                    if (cancelled) {
                        // do not hand a pooled thread back with our interrupt pending
                        Thread.interrupted();
                    }
                }
                finished.countDown();
            }
        }

        private synchronized boolean isCancelled() {
            return cancelled;
        }

        /**
         * Interrupt the worker if it is running and wait for it to finish.
         *
         * @return false if the worker was still running when the timeout elapsed
         */
        boolean cancelAndJoin(Duration timeout) {
            synchronized (this) {
                cancelled = true;
                if (!started) {
                    return true;
                }
                if (worker != null) {
                    worker.interrupt();
                }
            }
            boolean interrupted = Thread.interrupted();
            try {
                return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
                return finished.getCount() == 0;
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
