package io.cronrunner;

import io.cronrunner.core.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job operations consumed from the persistence collaborator.
 */
public interface JobStore {

    Optional<Job> findById(String jobId);

    List<Job> findAll();

    List<Job> findByEnabled(boolean enabled);

    /**
     * Insert or replace a job definition.
     *
     * @return the stored job with its id
     */
    Job save(Job job);

    /**
     * @param nextRunAt null clears the value
     */
    void updateNextRunAt(String jobId, Instant nextRunAt);

    void updateLastRunAt(String jobId, Instant lastRunAt);

    long count();

    long countEnabled();
}
