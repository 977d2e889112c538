package com.whereq.vigil.job;

import com.whereq.vigil.exception.OperationFailedException;
import com.whereq.vigil.exception.OperationTimeoutException;
import com.whereq.vigil.executor.CommandSpec;
import com.whereq.vigil.executor.OperationOutcome;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs an external program over the job's snapshot. {@code {snapshot}} in any argument
 * is replaced with the snapshot path.
 */
@Slf4j
public class CommandProcessStep implements ProcessStep {

    static final String SNAPSHOT_PLACEHOLDER = "{snapshot}";

    private final List<String> command;
    private final Path defaultSnapshot;
    private final Duration timeout;
    private final TimeoutGuardedExecutor executor;

    public CommandProcessStep(List<String> command, Path defaultSnapshot, Duration timeout,
                              TimeoutGuardedExecutor executor) {
        this.command = List.copyOf(command);
        this.defaultSnapshot = defaultSnapshot;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public void process(RunContext context) {
        Path snapshot = context.getSnapshot() != null ? context.getSnapshot() : defaultSnapshot;
        List<String> resolved = command.stream()
            .map(arg -> snapshot != null ? arg.replace(SNAPSHOT_PLACEHOLDER, snapshot.toString()) : arg)
            .collect(Collectors.toList());
        Duration deadline = context.remaining(timeout);

        OperationOutcome<String> outcome = executor.runCommand(
            CommandSpec.builder().command(resolved).build(), deadline);

        if (outcome.isTimedOut()) {
            throw new OperationTimeoutException("Processing of " + context.getJobName(), deadline);
        }
        if (!outcome.isSuccess()) {
            throw new OperationFailedException(outcome.getMessage(), outcome.getExitCode());
        }
        String output = outcome.getValue();
        if (output != null && !output.isBlank()) {
            log.info("{}", output.strip());
        }
    }
}
