package com.whereq.vigil.cli;

import com.whereq.vigil.model.SchedulingMode;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

import java.util.List;
import java.util.Set;

/**
 * Parsed command line: {@code [run] <job|all> [--sequential|--parallel] [--threads=N] [--status] [--stop] [--help] [--verbose]}
 */
@Value
@Builder
public class CommandLineOptions {

    public static final String ALL = "all";

    private static final Set<String> KNOWN_OPTIONS =
        Set.of("sequential", "parallel", "threads", "status", "stop", "help", "verbose");

    public enum Action {
        RUN,
        STATUS,
        STOP,
        HELP
    }

    Action action;

    /**
     * Job name or "all", null unless running
     */
    String target;

    SchedulingMode mode;

    /**
     * Scan concurrency override, null for the configured default
     */
    Integer threads;

    boolean verbose;

    public boolean isAll() {
        return ALL.equals(target);
    }

    /**
     * @throws IllegalArgumentException on unknown options or conflicting flags
     */
    public static CommandLineOptions parse(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            if (!KNOWN_OPTIONS.contains(option)) {
                throw new IllegalArgumentException("Unknown option: --" + option);
            }
        }

        boolean sequential = args.containsOption("sequential");
        boolean parallel = args.containsOption("parallel");
        if (sequential && parallel) {
            throw new IllegalArgumentException("--sequential and --parallel are mutually exclusive");
        }

        CommandLineOptionsBuilder options = CommandLineOptions.builder()
            .mode(sequential ? SchedulingMode.SEQUENTIAL : SchedulingMode.PARALLEL)
            .threads(threads(args))
            .verbose(args.containsOption("verbose"));

        if (args.containsOption("help")) {
            return options.action(Action.HELP).build();
        }
        if (args.containsOption("status")) {
            return options.action(Action.STATUS).build();
        }
        if (args.containsOption("stop")) {
            return options.action(Action.STOP).build();
        }

        List<String> positional = args.getNonOptionArgs();
        if (!positional.isEmpty() && "run".equals(positional.get(0))) {
            positional = positional.subList(1, positional.size());
        }
        if (positional.isEmpty()) {
            return options.action(Action.HELP).build();
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected one job name, got " + positional);
        }
        return options.action(Action.RUN).target(positional.get(0)).build();
    }

    private static Integer threads(ApplicationArguments args) {
        List<String> values = args.getOptionValues("threads");
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        try {
            int threads = Integer.parseInt(value);
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1, got " + threads);
            }
            return threads;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads expects a number, got '" + value + "'", e);
        }
    }
}
