package com.umitunal.qrunner.storage;

import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.core.JobStore;
import com.umitunal.qrunner.core.JobStoreTransaction;
import com.umitunal.qrunner.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class MemoryJobStoreTest extends JobStoreContractTest {

    @Override
    protected JobStore createStore() {
        return new MemoryJobStore();
    }

    @Test
    @DisplayName("Delete-all in a transaction should keep later inserts of the same transaction")
    void testDeleteAllThenInsert() throws Exception {
        store.saveJob(record("before", JobStatus.QUEUED, Instant.now()));

        JobStoreTransaction tx = store.beginTransaction();
        store.deleteAllJobs(tx);
        JobRecord after = record("after", JobStatus.QUEUED, Instant.now());
        store.saveJob(after, tx);
        tx.commit();

        assertThat(store.getJobCount(null, null, null, null)).isEqualTo(1);
        assertThat(store.getJob(after.getId())).isNotNull();
    }

    @Test
    @DisplayName("Should refuse transactions of another store")
    void testForeignTransaction() throws Exception {
        try (MemoryJobStore other = new MemoryJobStore()) {
            JobStoreTransaction foreign = other.beginTransaction();

            assertThatThrownBy(() -> store.getJob(1, foreign)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
