package io.cronrunner.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.cronrunner.RunLedger;
import io.cronrunner.core.JobNotFoundException;
import io.cronrunner.core.JobRun;
import io.cronrunner.core.RunStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for execution records ({@code job_runs} collection).
 */
public class MongoRunLedger implements RunLedger {

    private final MongoTemplate mongoTemplate;

    public MongoRunLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public JobRun create(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        JobRunDocument doc = toDocument(run);
        doc.setId(null);
        return toRun(mongoTemplate.insert(doc));
    }

    /**
     * Terminal write-back. Matches only while the stored status is still RUNNING, so whichever of
     * the engine and the terminator writes first wins and the other becomes a no-op.
     */
    @Override
    public boolean update(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        Objects.requireNonNull(run.id(), "run id must not be null");
        if (!run.isCompleted()) {
            throw new IllegalArgumentException("run must be in a terminal status: " + run.status());
        }

        Query q = new Query(
                Criteria.where("_id").is(run.id())
                        .and("status").is(RunStatus.RUNNING)
        );

        Update u = new Update()
                .set("status", run.status())
                .set("completedAt", run.completedAt())
                .set("durationSeconds", run.durationSeconds())
                .set("output", run.output())
                .set("errorMessage", run.errorMessage());

        UpdateResult r = mongoTemplate.updateFirst(q, u, JobRunDocument.class);
        return r.getMatchedCount() > 0;
    }

    @Override
    public Optional<JobRun> findById(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(runId, JobRunDocument.class)).map(MongoRunLedger::toRun);
    }

    @Override
    public List<JobRun> listForJob(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        if (!mongoTemplate.exists(new Query(Criteria.where("_id").is(jobId)), JobDocument.class)) {
            throw new JobNotFoundException(jobId);
        }

        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobRunDocument.class).stream().map(MongoRunLedger::toRun).toList();
    }

    @Override
    public List<JobRun> findRunning(String jobId) {
        return mongoTemplate.find(runningQuery(jobId), JobRunDocument.class).stream().map(MongoRunLedger::toRun).toList();
    }

    @Override
    public long countRunning() {
        return mongoTemplate.count(runningQuery(null), JobRunDocument.class);
    }

    private static Query runningQuery(String jobId) {
        Criteria c = Criteria.where("status").is(RunStatus.RUNNING);
        if (jobId != null) {
            c = c.and("jobId").is(jobId);
        }
        return new Query(c);
    }

    private static JobRunDocument toDocument(JobRun run) {
        JobRunDocument doc = new JobRunDocument();
        doc.setId(run.id());
        doc.setJobId(run.jobId());
        doc.setStatus(run.status());
        doc.setStartedAt(run.startedAt());
        doc.setCompletedAt(run.completedAt());
        doc.setDurationSeconds(run.durationSeconds());
        doc.setOutput(run.output());
        doc.setErrorMessage(run.errorMessage());
        return doc;
    }

    private static JobRun toRun(JobRunDocument doc) {
        return new JobRun(
                doc.getId(),
                doc.getJobId(),
                doc.getStatus(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getDurationSeconds(),
                doc.getOutput(),
                doc.getErrorMessage()
        );
    }
}
