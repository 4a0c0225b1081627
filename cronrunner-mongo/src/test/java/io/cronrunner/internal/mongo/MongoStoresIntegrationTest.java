package io.cronrunner.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.cronrunner.core.Job;
import io.cronrunner.core.JobNotFoundException;
import io.cronrunner.core.JobRun;
import io.cronrunner.core.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;
    private MongoRunLedger ledger;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "cronrunner_test");
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(JobRunDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
        ledger = new MongoRunLedger(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(JobRunDocument.class);
    }

    @Test
    void savedJobShouldRoundTripWithConfig() {
        Job saved = jobStore.save(Job.of(null, "nightly", "/srv/jobs/nightly.py", "0 2 * * *", true)
                .withConfig(Map.of("bucket", "exports", "retries", 3)));

        assertNotNull(saved.id());
        Job loaded = jobStore.findById(saved.id()).orElseThrow();
        assertEquals("nightly", loaded.name());
        assertEquals("0 2 * * *", loaded.cronExpression());
        assertEquals("exports", loaded.config().get("bucket"));
        assertEquals(3, loaded.config().get("retries"));
        assertTrue(loaded.enabled());
    }

    @Test
    void nextRunAtShouldBeSettableAndClearable() {
        Job job = jobStore.save(Job.of(null, "tick", "/srv/jobs/tick.py", "* * * * *", true));
        Instant next = Instant.now().plusSeconds(60).truncatedTo(ChronoUnit.MILLIS);

        jobStore.updateNextRunAt(job.id(), next);
        assertEquals(next, jobStore.findById(job.id()).orElseThrow().nextRunAt());

        jobStore.updateNextRunAt(job.id(), null);
        assertNull(jobStore.findById(job.id()).orElseThrow().nextRunAt());
    }

    @Test
    void enabledFilterAndCountsShouldAgree() {
        jobStore.save(Job.of(null, "a", "/srv/jobs/a.py", "* * * * *", true));
        jobStore.save(Job.of(null, "b", "/srv/jobs/b.py", "* * * * *", false));
        jobStore.save(Job.of(null, "c", "/srv/jobs/c.py", "* * * * *", true));

        assertEquals(3, jobStore.count());
        assertEquals(2, jobStore.countEnabled());
        assertEquals(List.of("a", "c"), jobStore.findByEnabled(true).stream().map(Job::name).toList());
        assertEquals(List.of("b"), jobStore.findByEnabled(false).stream().map(Job::name).toList());
    }

    @Test
    void terminalUpdateShouldApplyOnlyOnce() {
        Job job = jobStore.save(Job.of(null, "once", "/srv/jobs/once.py", "* * * * *", true));
        JobRun run = ledger.create(JobRun.started(job.id(), Instant.now().minusSeconds(5)));
        assertNotNull(run.id());
        assertEquals(1, ledger.countRunning());

        JobRun terminated = run.complete(RunStatus.FAILED, Instant.now(), null, "terminated");
        JobRun finished = run.complete(RunStatus.SUCCESS, Instant.now(), "done", null);

        assertTrue(ledger.update(terminated));
        assertFalse(ledger.update(finished));

        JobRun stored = ledger.findById(run.id()).orElseThrow();
        assertEquals(RunStatus.FAILED, stored.status());
        assertEquals("terminated", stored.errorMessage());
        assertNotNull(stored.completedAt());
        assertEquals(0, ledger.countRunning());
    }

    @Test
    void listForJobShouldReturnNewestFirstWithinLimit() {
        Job job = jobStore.save(Job.of(null, "hist", "/srv/jobs/hist.py", "* * * * *", true));
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            ledger.create(JobRun.started(job.id(), base.plusSeconds(i * 60L)));
        }

        List<JobRun> runs = ledger.listForJob(job.id(), 3);

        assertEquals(3, runs.size());
        assertEquals(base.plusSeconds(240), runs.get(0).startedAt());
        assertEquals(base.plusSeconds(120), runs.get(2).startedAt());
    }

    @Test
    void listForJobWithoutRunsShouldBeEmpty() {
        Job job = jobStore.save(Job.of(null, "fresh", "/srv/jobs/fresh.py", "* * * * *", true));

        assertTrue(ledger.listForJob(job.id(), 50).isEmpty());
    }

    @Test
    void listForUnknownJobShouldThrow() {
        assertThrows(JobNotFoundException.class, () -> ledger.listForJob("65a000000000000000000000", 50));
        assertThrows(IllegalArgumentException.class, () -> ledger.listForJob("x", 0));
    }

    @Test
    void findRunningShouldFilterByJob() {
        Job a = jobStore.save(Job.of(null, "a", "/srv/jobs/a.py", "* * * * *", true));
        Job b = jobStore.save(Job.of(null, "b", "/srv/jobs/b.py", "* * * * *", true));
        ledger.create(JobRun.started(a.id(), Instant.now()));
        ledger.create(JobRun.started(b.id(), Instant.now()));

        assertEquals(2, ledger.findRunning(null).size());
        assertEquals(1, ledger.findRunning(a.id()).size());
        assertEquals(a.id(), ledger.findRunning(a.id()).get(0).jobId());
    }
}
