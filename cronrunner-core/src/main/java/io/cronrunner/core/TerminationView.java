package io.cronrunner.core;

/**
 * The independent views of "what is running" that termination reconciles.
 */
public enum TerminationView {
    SCHEDULER,
    LEDGER,
    PROCESS
}
