package com.whereq.vigil.job;

import com.whereq.vigil.exception.OperationFailedException;
import com.whereq.vigil.exception.OperationTimeoutException;
import com.whereq.vigil.executor.CommandSpec;
import com.whereq.vigil.executor.OperationOutcome;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Fetches a snapshot by running an external program whose stdout is one JSON document.
 * Output goes to a staging file that is promoted only once it validates.
 */
@Slf4j
public class CommandSnapshotFetcher implements FetchStep {

    private final List<String> command;
    private final Path snapshot;
    private final Duration timeout;
    private final SnapshotStore store;
    private final TimeoutGuardedExecutor executor;

    public CommandSnapshotFetcher(List<String> command, Path snapshot, Duration timeout,
                                  SnapshotStore store, TimeoutGuardedExecutor executor) {
        this.command = List.copyOf(command);
        this.snapshot = snapshot;
        this.timeout = timeout;
        this.store = store;
        this.executor = executor;
    }

    @Override
    public Path fetch(RunContext context) throws IOException {
        Files.createDirectories(snapshot.toAbsolutePath().getParent());
        Path staged = store.stagingPath(snapshot);
        Duration deadline = context.remaining(timeout);

        log.info("Fetching data for {} into {}", context.getJobName(), snapshot);
        try {
            OperationOutcome<String> outcome = executor.runCommand(
                CommandSpec.builder().command(command).stdout(staged).build(), deadline);

            if (outcome.isTimedOut()) {
                throw new OperationTimeoutException("Fetch of " + context.getJobName(), deadline);
            }
            if (!outcome.isSuccess()) {
                throw new OperationFailedException(outcome.getMessage(), outcome.getExitCode());
            }
            return store.commit(staged, snapshot);
        } finally {
            Files.deleteIfExists(staged);
        }
    }
}
