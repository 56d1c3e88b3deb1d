package com.streamfirst.tokenindex.boot.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Component
@Command(
        name = "token-index",
        mixinStandardHelpOptions = true,
        version = "token-index 0.1.0",
        description = "Builds and serves the token hash index and CID cache, and validates pending node tokens.",
        subcommands = {
            HashIndexCommand.class,
            CidCacheCommand.class,
            ValidateCommand.class,
            ServeCommand.class,
            HexToCidCommand.class
        })
public class TokenIndexCommand implements Runnable {

    @Spec CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
