package io.cronrunner;

import io.cronrunner.core.TerminationResult;

/**
 * Best-effort cancellation of in-flight work.
 *
 * <p>Reconciles the scheduler entries, the run ledger and live processes independently. A process
 * may still complete after its run has been marked failed.
 */
public interface TerminationCoordinator {

    TerminationResult terminateAll();

    TerminationResult terminateOne(String jobId);
}
