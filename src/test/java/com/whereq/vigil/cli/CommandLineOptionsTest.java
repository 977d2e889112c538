package com.whereq.vigil.cli;

import com.whereq.vigil.model.SchedulingMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineOptionsTest {

    @Test
    void runAllDefaultsToParallel() {
        CommandLineOptions options = parse("run", "all");

        assertThat(options.getAction()).isEqualTo(CommandLineOptions.Action.RUN);
        assertThat(options.isAll()).isTrue();
        assertThat(options.getMode()).isEqualTo(SchedulingMode.PARALLEL);
        assertThat(options.getThreads()).isNull();
    }

    @Test
    void runVerbIsOptional() {
        CommandLineOptions options = parse("ports", "--threads=50", "--verbose");

        assertThat(options.getTarget()).isEqualTo("ports");
        assertThat(options.getThreads()).isEqualTo(50);
        assertThat(options.isVerbose()).isTrue();
    }

    @Test
    void sequentialFlag() {
        assertThat(parse("all", "--sequential").getMode()).isEqualTo(SchedulingMode.SEQUENTIAL);
    }

    @Test
    void controlActions() {
        assertThat(parse("--status").getAction()).isEqualTo(CommandLineOptions.Action.STATUS);
        assertThat(parse("--stop").getAction()).isEqualTo(CommandLineOptions.Action.STOP);
        assertThat(parse("--help").getAction()).isEqualTo(CommandLineOptions.Action.HELP);
        assertThat(parse().getAction()).isEqualTo(CommandLineOptions.Action.HELP);
    }

    @Test
    void invalidArguments() {
        assertThatThrownBy(() -> parse("all", "--sequential", "--parallel")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("all", "--threads=0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("all", "--threads=many")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("all", "--fast")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("gossip", "ports")).isInstanceOf(IllegalArgumentException.class);
    }

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(new DefaultApplicationArguments(args));
    }
}
