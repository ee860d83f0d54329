package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.DuplicateGroup;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsolePrompterTest {
    @Test
    void showsGroupAndReadsOneLine() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ConsolePrompter prompter = prompter("y\nn\n", output, Action.SYMLINK);
        DuplicateGroup group = ConfirmationSessionTest.groups(1).get(0);

        assertEquals(Optional.of("y"), prompter.ask(group, 1, 3));
        assertEquals(Optional.of("n"), prompter.ask(group, 2, 3));

        String shown = output.toString(StandardCharsets.UTF_8);
        assertTrue(shown.contains("[1/3] MASTER: " + group.masterPath()), shown);
        assertTrue(shown.contains("SYMLINK: " + group.duplicates().get(0).path()), shown);
        assertTrue(shown.contains("Symlink 1 duplicate(s)? [y/n/a/q]"), shown);
    }

    @Test
    void endOfInputIsEmpty() {
        ConsolePrompter prompter = prompter("", new ByteArrayOutputStream(), Action.DELETE);

        assertEquals(Optional.empty(), prompter.ask(ConfirmationSessionTest.groups(1).get(0), 1, 1));
    }

    @Test
    void actionLabelIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            prompter("q\n", output, Action.HARDLINK).ask(ConfirmationSessionTest.groups(1).get(0), 1, 1);

            assertTrue(output.toString(StandardCharsets.UTF_8).contains("HARDLINK: "));
        } finally {
            Locale.setDefault(previous);
        }
    }

    private static ConsolePrompter prompter(String input, ByteArrayOutputStream output, Action action) {
        return new ConsolePrompter(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8), action);
    }
}
