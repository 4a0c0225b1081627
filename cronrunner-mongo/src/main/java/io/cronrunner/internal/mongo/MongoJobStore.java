package io.cronrunner.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronrunner.JobStore;
import io.cronrunner.core.Job;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job definitions ({@code jobs} collection).
 *
 * <p>The scheduler only writes {@code nextRunAt} and {@code lastRunAt}; each is a single
 * {@code updateFirst} so it never clobbers concurrent edits of the definition.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(this::toJob);
    }

    @Override
    public List<Job> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("name")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(this::toJob).toList();
    }

    @Override
    public List<Job> findByEnabled(boolean enabled) {
        Query q = new Query(Criteria.where("enabled").is(enabled)).with(Sort.by(Sort.Order.asc("name")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(this::toJob).toList();
    }

    @Override
    public Job save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        JobDocument saved = mongoTemplate.save(toDocument(job));
        return toJob(saved);
    }

    @Override
    public void updateNextRunAt(String jobId, Instant nextRunAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update u = new Update();
        if (nextRunAt != null) {
            u.set("nextRunAt", nextRunAt);
        } else {
            u.unset("nextRunAt");
        }
        mongoTemplate.updateFirst(byId(jobId), u, JobDocument.class);
    }

    @Override
    public void updateLastRunAt(String jobId, Instant lastRunAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(lastRunAt, "lastRunAt must not be null");
        mongoTemplate.updateFirst(byId(jobId), new Update().set("lastRunAt", lastRunAt), JobDocument.class);
    }

    @Override
    public long count() {
        return mongoTemplate.count(new Query(), JobDocument.class);
    }

    @Override
    public long countEnabled() {
        return mongoTemplate.count(new Query(Criteria.where("enabled").is(true)), JobDocument.class);
    }

    private static Query byId(String jobId) {
        return new Query(Criteria.where("_id").is(jobId));
    }

    private JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setDescription(job.description());
        doc.setScriptPath(job.scriptPath());
        doc.setCronExpression(job.cronExpression());
        doc.setEnabled(job.enabled());
        doc.setConfig(objectMapper.convertValue(job.config(), new TypeReference<Map<String, Object>>() {
        }));
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        doc.setLastRunAt(job.lastRunAt());
        doc.setNextRunAt(job.nextRunAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     */
    Job toJob(JobDocument doc) {
        return new Job(
                doc.getId(),
                doc.getName(),
                doc.getDescription(),
                doc.getScriptPath(),
                doc.getCronExpression(),
                doc.isEnabled(),
                doc.getConfig(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getLastRunAt(),
                doc.getNextRunAt()
        );
    }
}
