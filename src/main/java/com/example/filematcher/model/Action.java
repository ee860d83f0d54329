package com.example.filematcher.model;

import java.util.Locale;

/**
 * What to do with each duplicate once its master has been chosen.
 */
public enum Action {
    COMPARE,
    HARDLINK,
    SYMLINK,
    DELETE;

    public static Action parse(String value) {
        try {
            return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown action '" + value + "' (expected compare, hardlink, symlink or delete).", ex);
        }
    }

    public boolean modifiesFiles() {
        return this != COMPARE;
    }

    public boolean createsLink() {
        return this == HARDLINK || this == SYMLINK;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
