package com.jokebot.scheduler.store;

import com.jokebot.scheduler.model.JobRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    private JobRecord job(String key, String jobId, Instant nextRunAt) {
        return JobRecord.builder()
                .key(key)
                .jobId(jobId)
                .handlerName("h")
                .intervalMinutes(5)
                .nextRunAt(nextRunAt)
                .createdAt(T0)
                .build();
    }

    @Test
    void upsertReplacesExistingJob() {
        store.upsert(job("u1", "job-1", T0));
        store.upsert(job("u1", "job-2", T0.plusSeconds(60)));

        assertThat(store.activeCount()).isEqualTo(1);
        assertThat(store.find("u1")).get().extracting(JobRecord::getJobId).isEqualTo("job-2");
    }

    @Test
    void findDueReturnsOldestFirstWithinLimit() {
        store.upsert(job("late", "j1", T0.plusSeconds(30)));
        store.upsert(job("early", "j2", T0.plusSeconds(10)));
        store.upsert(job("future", "j3", T0.plusSeconds(600)));

        assertThat(store.findDue(T0.plusSeconds(60), 10))
                .extracting(JobRecord::getKey)
                .containsExactly("early", "late");
        assertThat(store.findDue(T0.plusSeconds(60), 1)).hasSize(1);
    }

    @Test
    void returnedRecordsAreCopies() {
        store.upsert(job("u1", "j1", T0));

        store.find("u1").get().setFailCount(99);

        assertThat(store.find("u1").get().getFailCount()).isZero();
    }

    @Test
    void markRunIgnoresReplacedJob() {
        store.upsert(job("u1", "old", T0));
        store.upsert(job("u1", "new", T0.plusSeconds(300)));

        boolean updated = store.markRun("u1", "old", false, T0.plusSeconds(600), T0);

        assertThat(updated).isFalse();
        JobRecord current = store.find("u1").get();
        assertThat(current.getFailCount()).isZero();
        assertThat(current.getNextRunAt()).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    void markRunTracksFailuresAndResetsOnSuccess() {
        store.upsert(job("u1", "j1", T0));

        store.markRun("u1", "j1", false, T0.plusSeconds(300), T0);
        store.markRun("u1", "j1", false, T0.plusSeconds(600), T0.plusSeconds(300));
        assertThat(store.find("u1").get().getFailCount()).isEqualTo(2);
        assertThat(store.find("u1").get().getLastRunAt()).isNull();

        store.markRun("u1", "j1", true, T0.plusSeconds(900), T0.plusSeconds(600));
        JobRecord current = store.find("u1").get();
        assertThat(current.getFailCount()).isZero();
        assertThat(current.getLastRunAt()).isEqualTo(T0.plusSeconds(600));
        assertThat(current.getNextRunAt()).isEqualTo(T0.plusSeconds(900));
    }

    @Test
    void conditionalCancelOnlyRemovesMatchingJob() {
        store.upsert(job("u1", "j2", T0));

        assertThat(store.cancel("u1", "j1")).isFalse();
        assertThat(store.find("u1")).isPresent();
        assertThat(store.cancel("u1", "j2")).isTrue();
        assertThat(store.find("u1")).isEmpty();
    }

    @Test
    void cancelMissingKeyIsNoOp() {
        store.cancel("nobody");

        assertThat(store.activeCount()).isZero();
    }

    @Test
    void lockIsExclusiveUntilExpiry() {
        store.upsert(job("u1", "j1", T0));

        assertThat(store.tryLock("u1", "a", T0, T0.plusSeconds(120))).isTrue();
        assertThat(store.tryLock("u1", "b", T0.plusSeconds(60), T0.plusSeconds(180))).isFalse();
        assertThat(store.tryLock("u1", "b", T0.plus(Duration.ofMinutes(2)), T0.plusSeconds(240))).isTrue();
    }

    @Test
    void unlockOnlyByOwner() {
        store.tryLock("u1", "a", T0, T0.plusSeconds(120));

        store.unlock("u1", "b");
        assertThat(store.tryLock("u1", "b", T0, T0.plusSeconds(120))).isFalse();

        store.unlock("u1", "a");
        assertThat(store.tryLock("u1", "b", T0, T0.plusSeconds(120))).isTrue();
    }
}
