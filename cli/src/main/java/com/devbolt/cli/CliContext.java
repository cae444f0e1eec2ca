package com.devbolt.cli;

import com.devbolt.cli.output.Display;
import com.devbolt.cli.output.Prompter;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * What a command may touch: the directory it runs in, the terminal and the
 * clock used for evaluations.
 */
public final class CliContext {

    private final Path workingDirectory;
    private final Display display;
    private final Prompter prompter;
    private final Clock clock;

    public CliContext(Path workingDirectory, Display display, Prompter prompter, Clock clock) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        this.display = Objects.requireNonNull(display, "display must not be null");
        this.prompter = Objects.requireNonNull(prompter, "prompter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public Display getDisplay() {
        return display;
    }

    public Prompter getPrompter() {
        return prompter;
    }

    public Clock getClock() {
        return clock;
    }
}
