package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks about each group on a terminal. Reading stops at end of input, which counts as quitting.
 */
public final class ConsolePrompter implements ConfirmationPrompter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsolePrompter.class);

    private final BufferedReader reader;
    private final PrintStream out;
    private final Action action;

    public ConsolePrompter(InputStream in, PrintStream out, Action action) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.action = action;
    }

    /**
     * True when the JVM is attached to an interactive terminal.
     */
    public static boolean interactiveConsoleAvailable() {
        return System.console() != null;
    }

    @Override
    public Optional<String> ask(DuplicateGroup group, int index, int total) {
        out.printf("[%d/%d] MASTER: %s (%s)%n", index, total, group.masterPath(), group.reason().description());
        for (FileRecord duplicate : group.duplicates()) {
            out.printf("    %s: %s (%s)%n", action.label().toUpperCase(Locale.ROOT), duplicate.path(), FileSizes.format(duplicate.size()));
        }
        out.printf("%s %d duplicate(s)? [y/n/a/q] ", capitalize(action.label()), group.duplicates().size());
        out.flush();
        try {
            return Optional.ofNullable(reader.readLine());
        } catch (IOException ex) {
            LOGGER.warn("Could not read confirmation response: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void invalidResponse(String response) {
        out.println("Please answer y (yes), n (no), a (all remaining) or q (quit).");
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
