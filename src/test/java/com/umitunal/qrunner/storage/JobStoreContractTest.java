package com.umitunal.qrunner.storage;

import com.umitunal.qrunner.core.JobRecordOrderBy;
import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.core.JobStore;
import com.umitunal.qrunner.core.JobStoreException;
import com.umitunal.qrunner.core.JobStoreTransaction;
import com.umitunal.qrunner.model.JobRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour every job store adapter must share.
 */
abstract class JobStoreContractTest {

    protected JobStore store;

    protected abstract JobStore createStore() throws Exception;

    @BeforeEach
    void setUp() throws Exception {
        store = createStore();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    protected static JobRecord record(String name, JobStatus status, Instant queueDate) {
        JobRecord record = new JobRecord();
        record.setName(name);
        record.setJobType("type-" + name);
        record.setData("{}");
        record.setStatus(status);
        record.setQueueDate(queueDate);
        return record;
    }

    @Test
    @DisplayName("Should assign ids on insert and update by id")
    void testSaveAndUpdate() throws Exception {
        // Given
        JobRecord first = record("first", JobStatus.QUEUED, Instant.now());
        JobRecord second = record("second", JobStatus.QUEUED, Instant.now());

        // When
        store.saveJob(first);
        store.saveJob(second);
        first.setStatus(JobStatus.STARTED);
        first.setStartDate(Instant.now());
        store.saveJob(first);

        // Then
        assertThat(first.getId()).isNotNull();
        assertThat(second.getId()).isGreaterThan(first.getId());
        JobRecord stored = store.getJob(first.getId());
        assertThat(stored.getStatus()).isEqualTo(JobStatus.STARTED);
        assertThat(stored.getStartDate()).isEqualTo(first.getStartDate());
        assertThat(store.getJobCount(null, null, null, null)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return detached copies")
    void testDetachedRecords() throws Exception {
        JobRecord saved = record("detached", JobStatus.QUEUED, Instant.now());
        store.saveJob(saved);

        JobRecord loaded = store.getJob(saved.getId());
        loaded.setStatus(JobStatus.FAILED);
        saved.setName("renamed locally");

        JobRecord reloaded = store.getJob(saved.getId());
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(reloaded.getName()).isEqualTo("detached");
    }

    @Test
    @DisplayName("Should return null and skip unknown ids")
    void testUnknownIds() throws Exception {
        JobRecord saved = record("known", JobStatus.QUEUED, Instant.now());
        store.saveJob(saved);

        assertThat(store.getJob(9999)).isNull();
        assertThat(store.getJobs(List.of(9999L, saved.getId()), null))
                .extracting(JobRecord::getId)
                .containsExactly(saved.getId());
    }

    @Test
    @DisplayName("Should get queued jobs oldest first, not after the cutoff, up to the count")
    void testGetQueuedJobs() throws Exception {
        // Given
        Instant now = Instant.now();
        JobRecord newest = record("newest", JobStatus.QUEUED, now.minusSeconds(1));
        JobRecord oldest = record("oldest", JobStatus.QUEUED, now.minusSeconds(30));
        JobRecord middle = record("middle", JobStatus.QUEUED, now.minusSeconds(10));
        JobRecord future = record("future", JobStatus.QUEUED, now.plusSeconds(60));
        JobRecord started = record("started", JobStatus.STARTED, now.minusSeconds(60));
        for (JobRecord r : List.of(newest, oldest, middle, future, started)) {
            store.saveJob(r);
        }

        // When
        List<JobRecord> two = store.getJobs(JobStatus.QUEUED, 2, now);
        List<JobRecord> all = store.getJobs(JobStatus.QUEUED, 0, now);

        // Then
        assertThat(two).extracting(JobRecord::getName).containsExactly("oldest", "middle");
        assertThat(all).extracting(JobRecord::getName).containsExactly("oldest", "middle", "newest");
    }

    @Test
    @DisplayName("Should filter, order and page records")
    void testPagedQuery() throws Exception {
        // Given
        Instant now = Instant.now();
        for (int i = 1; i <= 5; i++) {
            JobRecord r = record("Report " + i, JobStatus.SUCCEEDED, now.minusSeconds(i));
            r.setScheduleName("Nightly");
            store.saveJob(r);
        }
        store.saveJob(record("cleanup", JobStatus.FAILED, now));

        // When
        List<JobRecord> page1 = store.getJobs("report", null, null, JobRecordOrderBy.NAME, true, 1, 2, null);
        List<JobRecord> page3 = store.getJobs("REPORT", null, null, JobRecordOrderBy.NAME, true, 3, 2, null);
        List<JobRecord> failed = store.getJobs(null, JobStatus.FAILED, null, JobRecordOrderBy.ID, false, 1, 10, null);
        List<JobRecord> scheduled = store.getJobs(null, null, "nightly", JobRecordOrderBy.QUEUE_DATE, false, 1, 10, null);

        // Then
        assertThat(page1).extracting(JobRecord::getName).containsExactly("Report 5", "Report 4");
        assertThat(page3).extracting(JobRecord::getName).containsExactly("Report 1");
        assertThat(failed).extracting(JobRecord::getName).containsExactly("cleanup");
        assertThat(scheduled).extracting(JobRecord::getName)
                .containsExactly("Report 5", "Report 4", "Report 3", "Report 2", "Report 1");
        assertThat(store.getJobCount("port", JobStatus.SUCCEEDED, "NIGHTLY", null)).isEqualTo(5);
        assertThat(store.getJobCount(null, JobStatus.QUEUED, null, null)).isZero();
    }

    @Test
    @DisplayName("Should reject invalid page arguments")
    void testInvalidPaging() {
        assertThatThrownBy(() -> store.getJobs(null, null, null, JobRecordOrderBy.ID, false, 0, 10, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.getJobs(null, null, null, JobRecordOrderBy.ID, false, 1, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should get the latest record per schedule and job type")
    void testLatestScheduledJobs() throws Exception {
        // Given
        Instant now = Instant.now();
        JobRecord oldA = scheduled("daily", "a", now.minus(Duration.ofDays(1)));
        JobRecord newA = scheduled("daily", "a", now);
        JobRecord onlyB = scheduled("DAILY", "b", now.minusSeconds(5));
        JobRecord other = scheduled("hourly", "a", now);
        JobRecord unscheduled = record("plain", JobStatus.QUEUED, now);
        for (JobRecord r : List.of(oldA, newA, onlyB, other, unscheduled)) {
            store.saveJob(r);
        }

        // When
        List<JobRecord> latest = store.getLatestScheduledJobs(List.of("daily"), null);

        // Then
        assertThat(latest).extracting(JobRecord::getId).containsExactlyInAnyOrder(newA.getId(), onlyB.getId());
        assertThat(store.getLatestScheduledJobs(List.of(), null)).isEmpty();
    }

    @Test
    @DisplayName("Should delete single, old and all records")
    void testDeletes() throws Exception {
        // Given
        Instant now = Instant.now();
        JobRecord oldDone = record("old-done", JobStatus.SUCCEEDED, now.minus(Duration.ofDays(10)));
        JobRecord oldRunning = record("old-running", JobStatus.STARTED, now.minus(Duration.ofDays(10)));
        JobRecord recent = record("recent", JobStatus.SUCCEEDED, now);
        JobRecord doomed = record("doomed", JobStatus.QUEUED, now);
        for (JobRecord r : List.of(oldDone, oldRunning, recent, doomed)) {
            store.saveJob(r);
        }

        // When
        store.deleteJob(doomed.getId());
        long purged = store.deleteJobs(now.minus(Duration.ofDays(1)), null);

        // Then
        assertThat(purged).isEqualTo(1);
        assertThat(store.getJob(doomed.getId())).isNull();
        assertThat(store.getJob(oldDone.getId())).isNull();
        assertThat(store.getJob(oldRunning.getId())).isNotNull();
        assertThat(store.getJob(recent.getId())).isNotNull();

        store.deleteAllJobs(null);
        assertThat(store.getJobCount(null, null, null, null)).isZero();
    }

    @Test
    @DisplayName("Committed writes should become visible, rolled back writes should not")
    void testCommitAndRollback() throws Exception {
        // Given
        JobRecord committed = record("committed", JobStatus.QUEUED, Instant.now());
        JobRecord rolledBack = record("rolled-back", JobStatus.QUEUED, Instant.now());

        // When
        JobStoreTransaction tx = store.beginTransaction();
        store.saveJob(committed, tx);
        assertThat(store.getJob(committed.getId(), tx)).isNotNull();
        tx.commit();

        JobStoreTransaction tx2 = store.beginTransaction();
        store.saveJob(rolledBack, tx2);
        store.deleteJob(committed.getId(), tx2);
        assertThat(store.getJob(committed.getId(), tx2)).isNull();
        tx2.rollback();

        // Then
        assertThat(store.getJob(committed.getId())).isNotNull();
        assertThat(store.getJob(rolledBack.getId())).isNull();
        assertThat(tx.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("Closing an open transaction should commit it")
    void testCloseCommits() throws Exception {
        JobRecord saved = record("auto", JobStatus.QUEUED, Instant.now());

        try (JobStoreTransaction tx = store.beginTransaction()) {
            store.saveJob(saved, tx);
        }

        assertThat(store.getJob(saved.getId())).isNotNull();
    }

    @Test
    @DisplayName("Queries in a transaction should see its own changes")
    void testReadYourWrites() throws Exception {
        JobRecord existing = record("existing", JobStatus.QUEUED, Instant.now().minusSeconds(5));
        store.saveJob(existing);

        JobStoreTransaction tx = store.beginTransaction();
        store.saveJob(record("pending", JobStatus.QUEUED, Instant.now().minusSeconds(1)), tx);
        existing.setStatus(JobStatus.STARTED);
        store.saveJob(existing, tx);

        assertThat(store.getJobs(JobStatus.QUEUED, 0, Instant.now(), tx))
                .extracting(JobRecord::getName).containsExactly("pending");
        assertThat(store.getJobs(JobStatus.QUEUED, 0, Instant.now()))
                .extracting(JobRecord::getName).containsExactly("existing");
        tx.rollback();
    }

    @Test
    @DisplayName("Completed transactions should not be reusable")
    void testCompletedTransaction() throws Exception {
        JobStoreTransaction tx = store.beginTransaction();
        tx.commit();

        assertThatThrownBy(tx::commit).isInstanceOf(JobStoreException.class);
        assertThatThrownBy(() -> store.getJob(1, tx)).isInstanceOf(JobStoreException.class);
    }

    private static JobRecord scheduled(String scheduleName, String jobType, Instant queueDate) {
        JobRecord record = record(scheduleName + "-" + jobType, JobStatus.SUCCEEDED, queueDate);
        record.setJobType(jobType);
        record.setScheduleName(scheduleName);
        return record;
    }
}
