package io.cronrunner;

import io.cronrunner.core.JobRun;

import java.util.Optional;

public interface ExecutionEngine {

    /**
     * Run the job's script once and record the outcome in the run ledger.
     *
     * <p>Blocks until the process exits or the execution timeout expires.
     *
     * @return the terminal run, or empty when the job does not exist
     */
    Optional<JobRun> execute(String jobId);
}
