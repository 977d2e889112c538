package com.whereq.vigil.executor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * An external program invocation
 */
@Value
@Builder
public class CommandSpec {

    @Singular("arg")
    List<String> command;

    /**
     * Working directory, the current one when null
     */
    Path workingDir;

    @Singular("env")
    Map<String, String> environment;

    /**
     * File receiving stdout; when null stdout is captured and returned as the outcome value
     */
    Path stdout;

    public String describe() {
        return String.join(" ", command);
    }
}
