package com.whereq.vigil.cli;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.job.JobRegistry;
import com.whereq.vigil.job.RunContext;
import com.whereq.vigil.model.RunSummary;
import com.whereq.vigil.service.JobControlService;
import com.whereq.vigil.service.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Command line entry: runs one invocation and exposes its exit code.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "vigil.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class VigilCommandLine implements ApplicationRunner, ExitCodeGenerator {

    static final int USAGE_EXIT_CODE = 1;

    private final JobScheduler scheduler;
    private final JobControlService controlService;
    private final JobRegistry registry;
    private final VigilProperties properties;
    private final LoggingSystem loggingSystem;

    private int exitCode;

    public VigilCommandLine(JobScheduler scheduler, JobControlService controlService, JobRegistry registry,
                            VigilProperties properties, LoggingSystem loggingSystem) {
        this.scheduler = scheduler;
        this.controlService = controlService;
        this.registry = registry;
        this.properties = properties;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.out.println(usage());
            exitCode = USAGE_EXIT_CODE;
            return;
        }

        if (options.isVerbose() || properties.isDebug()) {
            loggingSystem.setLogLevel("com.whereq.vigil", LogLevel.DEBUG);
            log.debug("Debug logging enabled");
        }

        exitCode = switch (options.getAction()) {
            case HELP -> {
                System.out.println(usage());
                yield 0;
            }
            case STATUS -> {
                controlService.status();
                yield 0;
            }
            case STOP -> {
                controlService.stop();
                yield 0;
            }
            case RUN -> run(options);
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int run(CommandLineOptions options) {
        if (!options.isAll() && !registry.contains(options.getTarget())) {
            log.error("Unknown job: {}", options.getTarget());
            System.out.println(usage());
            return USAGE_EXIT_CODE;
        }

        RunContext context = RunContext.root(options.getThreads());
        RunSummary summary = options.isAll()
            ? scheduler.runAll(options.getMode(), context)
            : scheduler.runOne(options.getTarget(), context);
        return summary.exitCode();
    }

    String usage() {
        return String.join(System.lineSeparator(),
            "Usage: vigil [run] <job|all> [options]",
            "",
            "Jobs: " + String.join(", ", registry.names()) + ", all",
            "",
            "Options:",
            "  --sequential   run jobs one at a time, in listed order",
            "  --parallel     run all jobs at once (default for 'all')",
            "  --threads=N    scan concurrency (default " + properties.getThreads() + ")",
            "  --status       show which jobs are running",
            "  --stop         stop running jobs on this host",
            "  --verbose      debug logging",
            "  --help         show this help",
            "",
            "Exit code: 0 on success, the job's exit code for a single job (124 on timeout),",
            "the number of failed jobs for 'all'.");
    }
}
