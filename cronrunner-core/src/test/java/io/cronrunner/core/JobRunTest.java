package io.cronrunner.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRunTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void startedRunShouldBeRunningWithoutCompletion() {
        JobRun run = JobRun.started("1", START);

        assertEquals(RunStatus.RUNNING, run.status());
        assertTrue(run.isRunning());
        assertFalse(run.isCompleted());
        assertNull(run.completedAt());
        assertNull(run.durationSeconds());
    }

    @Test
    void completeShouldComputeWholeSecondDuration() {
        JobRun done = JobRun.started("1", START).withId("r1")
                .complete(RunStatus.SUCCESS, START.plusMillis(2_900), "out", null);

        assertEquals("r1", done.id());
        assertEquals(2L, done.durationSeconds());
        assertTrue(done.isCompleted());
    }

    @Test
    void completeShouldRejectNonTerminalStatus() {
        JobRun run = JobRun.started("1", START);

        assertThrows(IllegalArgumentException.class, () -> run.complete(RunStatus.RUNNING, START, null, null));
        assertThrows(IllegalArgumentException.class, () -> run.complete(RunStatus.PENDING, START, null, null));
    }

    @Test
    void nonZeroExitMessageShouldPreferStderr() {
        assertEquals("boom", new NonZeroExitException(2, "boom").getMessage());
        assertEquals("Process exited with code 2", new NonZeroExitException(2, " ").getMessage());
    }

    @Test
    void terminationResultShouldGroupFailuresByView() {
        TerminationResult result = TerminationResult.builder()
                .entryRemoved()
                .runFailed()
                .runFailed()
                .failure(TerminationView.PROCESS, "42", "not permitted")
                .build();

        assertEquals(1, result.entriesRemoved());
        assertEquals(2, result.runsFailed());
        assertTrue(result.hasFailures());
        assertEquals(1, result.failures(TerminationView.PROCESS).size());
        assertTrue(result.failures(TerminationView.LEDGER).isEmpty());
        assertFalse(TerminationResult.empty().hasFailures());
    }
}
