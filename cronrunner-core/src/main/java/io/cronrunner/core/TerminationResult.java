package io.cronrunner.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a termination request.
 *
 * entriesRemoved   : one-shot scheduler entries removed
 * runsFailed       : running ledger rows force-transitioned to FAILED
 * processesKilled  : OS processes signalled successfully
 * failures         : per-item failures across all views
 *
 * <p>Termination is advisory: a non-empty failure list is a partial failure, never an exception.
 */
public record TerminationResult(
        int entriesRemoved,
        int runsFailed,
        int processesKilled,
        List<TerminationFailure> failures
) {

    public TerminationResult {
        failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
    }

    public static TerminationResult empty() {
        return new TerminationResult(0, 0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<TerminationFailure> failures(TerminationView view) {
        return failures.stream().filter(f -> f.view() == view).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int entriesRemoved;
        private int runsFailed;
        private int processesKilled;
        private final List<TerminationFailure> failures = new ArrayList<>();

        public Builder entryRemoved() {
            entriesRemoved++;
            return this;
        }

        public Builder runFailed() {
            runsFailed++;
            return this;
        }

        public Builder processKilled() {
            processesKilled++;
            return this;
        }

        public Builder failure(TerminationView view, String target, String reason) {
            failures.add(new TerminationFailure(view, target, reason));
            return this;
        }

        public TerminationResult build() {
            return new TerminationResult(entriesRemoved, runsFailed, processesKilled, failures);
        }
    }
}
