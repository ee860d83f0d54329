package com.example.filematcher;

import com.example.filematcher.model.MatchReport;

public record RunResult(
        int exitCode,
        MatchReport report
) {
}
