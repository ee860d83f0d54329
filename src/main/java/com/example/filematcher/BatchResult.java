package com.example.filematcher;

import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.ExecutionSummary;

import java.nio.file.Path;
import java.util.Map;

public record BatchResult(
        ExecutionSummary summary,
        Map<Path, ActionOutcome> outcomes
) {
    public BatchResult {
        outcomes = Map.copyOf(outcomes);
    }
}
