package io.cronrunner.config;

import io.cronrunner.internal.mongo.JobDocument;
import io.cronrunner.internal.mongo.JobRunDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the {@code jobs} and {@code job_runs} collections.
 *
 * <p>Indexes are <b>not</b> created automatically unless
 * {@code cronrunner.ensure-indexes-on-startup=true}; production deployments usually manage them
 * through migration scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_jobs_enabled</b>: { enabled: 1 }, used by startup load and status counts</li>
 *   <li><b>ux_jobs_name</b> (unique): { name: 1 }</li>
 *   <li><b>idx_jobs_next_run</b>: { nextRunAt: 1 }</li>
 *   <li><b>idx_runs_job_started</b>: { jobId: 1, startedAt: -1 }, used by run history</li>
 *   <li><b>idx_runs_status</b>: { status: 1 }, used by termination and running counts</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ enabled: 1 }, { name: "idx_jobs_enabled" });
 * db.jobs.createIndex({ name: 1 }, { name: "ux_jobs_name", unique: true });
 * db.jobs.createIndex({ nextRunAt: 1 }, { name: "idx_jobs_next_run" });
 * db.job_runs.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_runs_job_started" });
 * db.job_runs.createIndex({ status: 1 }, { name: "idx_runs_status" });
 * </pre>
 */
public class CronRunnerMongoIndexConfig {

    public static final String IDX_JOBS_ENABLED = "idx_jobs_enabled";
    public static final String UX_JOBS_NAME = "ux_jobs_name";
    public static final String IDX_JOBS_NEXT_RUN = "idx_jobs_next_run";
    public static final String IDX_RUNS_JOB_STARTED = "idx_runs_job_started";
    public static final String IDX_RUNS_STATUS = "idx_runs_status";

    private final MongoTemplate mongoTemplate;

    public CronRunnerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobsEnabledIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobsNameUniqueIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobsNextRunIndex());
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(runsJobStartedIndex());
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(runsStatusIndex());
    }

    public static Index jobsEnabledIndex() {
        return new Index().on("enabled", Sort.Direction.ASC).named(IDX_JOBS_ENABLED);
    }

    public static Index jobsNameUniqueIndex() {
        return new Index().on("name", Sort.Direction.ASC).unique().named(UX_JOBS_NAME);
    }

    public static Index jobsNextRunIndex() {
        return new Index().on("nextRunAt", Sort.Direction.ASC).named(IDX_JOBS_NEXT_RUN);
    }

    /**
     * Keys: jobId ASC, startedAt DESC
     */
    public static Index runsJobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_JOB_STARTED);
    }

    public static Index runsStatusIndex() {
        return new Index().on("status", Sort.Direction.ASC).named(IDX_RUNS_STATUS);
    }
}
