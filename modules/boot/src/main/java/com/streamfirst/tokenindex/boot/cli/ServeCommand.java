package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.application.TokenLookupService;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * Serves the lookup API. The web server is started by Spring before this runs; the command only
 * warms the lookup service and returns, leaving the server running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(name = "serve", mixinStandardHelpOptions = true, description = "Serve the CID lookup API over HTTP.")
public class ServeCommand implements Callable<Integer> {

    private final ObjectProvider<TokenLookupService> lookup;
    private final Environment environment;

    @Override
    public Integer call() {
        lookup.getObject();
        log.info("Lookup API listening on port {}", environment.getProperty("local.server.port", "8080"));
        return 0;
    }
}
