package com.example.filematcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(1);

    private App() {
    }

    public static void main(String[] args) {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar file-matcher.jar <config.json>");
            System.exit(ExitCodes.SETUP_ERROR);
        }
        System.exit(run(Path.of(args[0])));
    }

    static int run(Path configPath) {
        MatcherConfig config;
        try {
            config = new ConfigLoader().load(configPath);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration {}: {}", configPath, ex.getMessage());
            return ExitCodes.SETUP_ERROR;
        }

        CancellationToken cancellationToken = new CancellationToken();
        Thread interruptHandler = new Thread(() -> awaitBoundary(cancellationToken), "file-matcher-interrupt");
        Runtime.getRuntime().addShutdownHook(interruptHandler);

        // Prompts only make sense on a terminal; the engine refuses to prompt without one.
        Optional<ConfirmationPrompter> prompter = ConsolePrompter.interactiveConsoleAvailable()
                ? Optional.of(new ConsolePrompter(System.in, System.out, config.action()))
                : Optional.empty();
        FileMatcherEngine engine = new FileMatcherEngine(config, new NioFileOperations(), prompter, cancellationToken);
        try {
            return engine.run().exitCode();
        } catch (SetupException ex) {
            LOGGER.error("{}", ex.getMessage());
            return ExitCodes.SETUP_ERROR;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("Run aborted", ex);
            return ExitCodes.SETUP_ERROR;
        }
    }

    private static void awaitBoundary(CancellationToken cancellationToken) {
        cancellationToken.cancel();
        try {
            if (!cancellationToken.awaitFinish(SHUTDOWN_GRACE)) {
                LOGGER.warn("Gave up waiting for the current group to finish");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
