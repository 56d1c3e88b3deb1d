package com.streamfirst.tokenindex.boot;

import com.streamfirst.tokenindex.boot.cli.TokenIndexCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/** Hands the command line to picocli and keeps its exit code for {@link TokenIndexApplication}. */
@Component
@RequiredArgsConstructor
public class CommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final IFactory factory;
    private final TokenIndexCommand command;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command, factory).execute(TokenIndexApplication.commandArgs(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
