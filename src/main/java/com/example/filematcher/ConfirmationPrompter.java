package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;

import java.util.Optional;

@FunctionalInterface
public interface ConfirmationPrompter {
    /**
     * Shows the group and reads one response line. An empty result means input ended or was interrupted.
     */
    Optional<String> ask(DuplicateGroup group, int index, int total);

    /**
     * Called when a response was not understood, before the same group is asked again.
     */
    default void invalidResponse(String response) {
    }
}
