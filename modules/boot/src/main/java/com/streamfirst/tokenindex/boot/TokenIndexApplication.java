package com.streamfirst.tokenindex.boot;

import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. Runs one command inside the Spring context; only {@code serve} starts the web
 * server and keeps the process alive.
 */
@SpringBootApplication
public class TokenIndexApplication {

    public static void main(String[] args) {
        boolean serve = isServe(args);
        SpringApplication app = new SpringApplication(TokenIndexApplication.class);
        app.setWebApplicationType(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE);
        ConfigurableApplicationContext context = app.run(args);
        if (!serve) {
            System.exit(SpringApplication.exit(context));
        }
    }

    static boolean isServe(String[] args) {
        return Arrays.stream(commandArgs(args)).findFirst().filter("serve"::equals).isPresent();
    }

    /** Drops Spring property overrides such as {@code --tokenindex.lookup.cache-capacity=5}. */
    static String[] commandArgs(String[] args) {
        return Arrays.stream(args).filter(arg -> !isPropertyOverride(arg)).toArray(String[]::new);
    }

    private static boolean isPropertyOverride(String arg) {
        if (!arg.startsWith("--")) {
            return false;
        }
        int dot = arg.indexOf('.');
        int eq = arg.indexOf('=');
        return dot > 0 && eq > dot;
    }
}
