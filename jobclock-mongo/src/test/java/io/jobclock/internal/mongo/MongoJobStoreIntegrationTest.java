package io.jobclock.internal.mongo;

import com.mongodb.client.MongoClients;
import io.jobclock.core.Job;
import io.jobclock.core.JobDefinition;
import io.jobclock.core.JobPatch;
import io.jobclock.core.JobStatus;
import io.jobclock.core.Schedule;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;
    private Instant now;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "jobclock_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, 50);
        // Mongo keeps millisecond precision
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void saveAndFindShouldRoundTripEveryField() {
        Job job = Job.create(new JobDefinition("crunch", Schedule.every(15), "dummy_number_crunch",
                Map.of("multiplier", 3, "label", "nightly")), now);

        jobStore.save(job);

        assertEquals(job, jobStore.findById(job.id()).orElseThrow());
        assertTrue(jobStore.findById("missing").isEmpty());
    }

    @Test
    void documentShouldUseSnakeCaseFieldsAndKeepNullRunTimes() {
        Job job = Job.create(new JobDefinition("cron", Schedule.cron("*/5 * * * *"), "print_hello", null), now);
        jobStore.save(job);

        Document raw = mongoTemplate.getCollection("jobs").find(new Document("_id", job.id())).first();

        assertNotNull(raw);
        assertEquals("*/5 * * * *", raw.getString("cron_expression"));
        assertEquals("print_hello", raw.getString("function_name"));
        assertEquals("ACTIVE", raw.getString("status"));
        assertTrue(raw.containsKey("last_run_at"));
        assertNull(raw.get("last_run_at"));
        assertTrue(raw.containsKey("interval_seconds"));
    }

    @Test
    void saveShouldOverwriteExistingJob() {
        Job job = jobStore.save(Job.create(new JobDefinition("hello", Schedule.every(10), "print_hello", null), now));

        Job paused = jobStore.save(job.transitionTo(JobStatus.PAUSED, now));

        assertEquals(JobStatus.PAUSED, paused.status());
        assertEquals(1, jobStore.findAll().size());
    }

    @Test
    void updateShouldApplyMutationAtomically() {
        Job job = jobStore.save(Job.create(new JobDefinition("hello", Schedule.every(10), "print_hello", null), now));
        Instant ranAt = now.plusSeconds(10);

        Job updated = jobStore.update(job.id(), j -> j.recordRun(ranAt)).orElseThrow();

        assertEquals(ranAt, updated.lastRunAt());
        assertEquals(ranAt.plusSeconds(10), updated.nextRunAt());
        assertEquals(updated, jobStore.findById(job.id()).orElseThrow());
        assertTrue(jobStore.update("missing", j -> j.recordRun(ranAt)).isEmpty());
    }

    @Test
    void updateShouldRejectIdChange() {
        Job job = jobStore.save(Job.create(new JobDefinition("hello", Schedule.every(10), "print_hello", null), now));
        Job other = Job.create(new JobDefinition("other", Schedule.every(10), "print_hello", null), now);

        assertThrows(IllegalArgumentException.class, () -> jobStore.update(job.id(), j -> other));
    }

    @Test
    void concurrentUpdatesShouldNotLoseWrites() throws Exception {
        Job job = jobStore.save(Job.create(
                new JobDefinition("counter", Schedule.every(10), "print_hello", Map.of("count", 0)), now));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                tasks.add(() -> {
                    jobStore.update(job.id(), j -> j.patch(
                            new JobPatch(null, null, null, Map.of("count", ((Number) j.metadata().get("count")).intValue() + 1), null),
                            now));
                    return null;
                });
            }
            for (Future<Void> f : pool.invokeAll(tasks)) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        Job stored = jobStore.findById(job.id()).orElseThrow();
        assertEquals(20, ((Number) stored.metadata().get("count")).intValue());
    }

    @Test
    void findAllActiveShouldOnlyReturnActiveJobs() {
        Job active = jobStore.save(Job.create(new JobDefinition("a", Schedule.every(10), "print_hello", null), now));
        jobStore.save(Job.create(new JobDefinition("p", Schedule.every(10), "print_hello", null, JobStatus.PAUSED), now));
        jobStore.save(Job.create(new JobDefinition("f", Schedule.every(10), "print_hello", null), now).markFailed());

        List<Job> result = jobStore.findAllActive();

        assertEquals(1, result.size());
        assertEquals(active.id(), result.get(0).id());
        assertEquals(3, jobStore.findAll().size());
    }

    @Test
    void deleteShouldRemoveDocuments() {
        Job a = jobStore.save(Job.create(new JobDefinition("a", Schedule.every(10), "print_hello", null), now));
        jobStore.save(Job.create(new JobDefinition("b", Schedule.every(10), "print_hello", null), now));
        jobStore.save(Job.create(new JobDefinition("c", Schedule.every(10), "print_hello", null), now));

        assertTrue(jobStore.deleteById(a.id()));
        assertFalse(jobStore.deleteById(a.id()));
        assertEquals(2, jobStore.deleteAll());
        assertTrue(jobStore.findAll().isEmpty());
        assertEquals(0, jobStore.deleteAll());
    }
}
