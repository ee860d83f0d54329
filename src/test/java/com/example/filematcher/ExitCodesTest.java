package com.example.filematcher;

import com.example.filematcher.model.ExecutionSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExitCodesTest {
    @Test
    void mapsCountsToExitCodes() {
        assertEquals(0, ExitCodes.of(3, 0, false));
        assertEquals(0, ExitCodes.of(0, 0, false));
        assertEquals(1, ExitCodes.of(0, 2, false));
        assertEquals(2, ExitCodes.of(5, 1, false));
    }

    @Test
    void cancellationWinsRegardlessOfCounts() {
        assertEquals(130, ExitCodes.of(0, 0, true));
        assertEquals(130, ExitCodes.of(4, 0, true));
        assertEquals(130, ExitCodes.of(0, 4, true));
        assertEquals(130, ExitCodes.of(2, 2, true));
    }

    @Test
    void readsCancellationFromSummary() {
        ExecutionSummary cancelled = new ExecutionSummary(1, 0, 0, 0, 3, 10L, List.of(), true);

        assertEquals(ExitCodes.INTERRUPTED, ExitCodes.of(cancelled));
        assertEquals(ExitCodes.SUCCESS, ExitCodes.of(cancelled, false));
    }
}
