package io.cronrunner.core;

/**
 * Lifecycle state of a {@link JobRun}.
 *
 * <p>{@code PENDING} is only the storage default; the execution engine creates runs directly in
 * {@code RUNNING}. {@code SUCCESS} and {@code FAILED} are terminal.
 */
public enum RunStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCESS {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
