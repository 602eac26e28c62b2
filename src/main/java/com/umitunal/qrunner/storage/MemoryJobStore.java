package com.umitunal.qrunner.storage;

import com.umitunal.qrunner.core.JobRecordOrderBy;
import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.core.JobStore;
import com.umitunal.qrunner.core.JobStoreException;
import com.umitunal.qrunner.core.JobStoreTransaction;
import com.umitunal.qrunner.model.JobRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-process job store. Nothing survives the JVM; used for tests and embedded runners
 * that do not need durability.
 *
 * A transaction stages its writes and deletes and applies them atomically on commit.
 * Reads through a transaction see committed data overlaid with the staged changes.
 */
public class MemoryJobStore implements JobStore {
    private final Object lock = new Object();
    private final TreeMap<Long, JobRecord> records = new TreeMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public JobStoreTransaction beginTransaction() {
        return new MemoryTransaction();
    }

    @Override
    public void saveJob(JobRecord record, JobStoreTransaction tx) throws JobStoreException {
        Objects.requireNonNull(record, "record");
        MemoryTransaction txn = unwrap(tx);

        if (record.getId() == null) {
            record.setId(sequence.incrementAndGet());
        }
        JobRecord copy = record.copy();

        if (txn != null) {
            txn.deleted.remove(copy.getId());
            txn.staged.put(copy.getId(), copy);
        } else {
            synchronized (lock) {
                records.put(copy.getId(), copy);
            }
        }
    }

    @Override
    public JobRecord getJob(long id, JobStoreTransaction tx) throws JobStoreException {
        MemoryTransaction txn = unwrap(tx);
        if (txn != null) {
            if (txn.deleted.contains(id)) {
                return null;
            }
            JobRecord staged = txn.staged.get(id);
            if (staged != null) {
                return staged.copy();
            }
            if (txn.clearAll) {
                return null;
            }
        }
        synchronized (lock) {
            JobRecord record = records.get(id);
            return record == null ? null : record.copy();
        }
    }

    @Override
    public List<JobRecord> getJobs(Collection<Long> ids, JobStoreTransaction tx) throws JobStoreException {
        Objects.requireNonNull(ids, "ids");
        List<JobRecord> found = new ArrayList<>();
        for (Long id : new TreeSet<>(ids)) {
            JobRecord record = getJob(id, tx);
            if (record != null) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    public List<JobRecord> getJobs(JobStatus status, int maxCount, Instant before, JobStoreTransaction tx)
            throws JobStoreException {
        return JobQueries.oldestFirst(scan(unwrap(tx), JobQueries.queuedBy(status, before)), maxCount);
    }

    @Override
    public List<JobRecord> getJobs(String likeName, JobStatus status, String scheduleName,
                                   JobRecordOrderBy orderBy, boolean descending, int page, int pageSize,
                                   JobStoreTransaction tx) throws JobStoreException {
        List<JobRecord> matching = scan(unwrap(tx), JobQueries.filter(likeName, status, scheduleName));
        return JobQueries.page(matching, orderBy, descending, page, pageSize);
    }

    @Override
    public long getJobCount(String likeName, JobStatus status, String scheduleName, JobStoreTransaction tx)
            throws JobStoreException {
        return scan(unwrap(tx), JobQueries.filter(likeName, status, scheduleName)).size();
    }

    @Override
    public List<JobRecord> getLatestScheduledJobs(Collection<String> scheduleNames, JobStoreTransaction tx)
            throws JobStoreException {
        Objects.requireNonNull(scheduleNames, "scheduleNames");
        if (scheduleNames.isEmpty()) {
            return List.of();
        }
        return JobQueries.latestPerScheduleAndType(scan(unwrap(tx), JobQueries.inSchedules(scheduleNames)));
    }

    @Override
    public void deleteJob(long id, JobStoreTransaction tx) throws JobStoreException {
        MemoryTransaction txn = unwrap(tx);
        if (txn != null) {
            txn.staged.remove(id);
            txn.deleted.add(id);
        } else {
            synchronized (lock) {
                records.remove(id);
            }
        }
    }

    @Override
    public void deleteAllJobs(JobStoreTransaction tx) throws JobStoreException {
        MemoryTransaction txn = unwrap(tx);
        if (txn != null) {
            txn.staged.clear();
            txn.deleted.clear();
            txn.clearAll = true;
        } else {
            synchronized (lock) {
                records.clear();
            }
        }
    }

    @Override
    public long deleteJobs(Instant olderThan, JobStoreTransaction tx) throws JobStoreException {
        MemoryTransaction txn = unwrap(tx);
        List<JobRecord> doomed = scan(txn, JobQueries.purgeable(olderThan));

        if (txn != null) {
            for (JobRecord record : doomed) {
                txn.staged.remove(record.getId());
                txn.deleted.add(record.getId());
            }
        } else {
            synchronized (lock) {
                for (JobRecord record : doomed) {
                    records.remove(record.getId());
                }
            }
        }
        return doomed.size();
    }

    @Override
    public void close() {
        synchronized (lock) {
            records.clear();
        }
    }

    private List<JobRecord> scan(MemoryTransaction txn, Predicate<JobRecord> predicate) {
        Map<Long, JobRecord> view;
        synchronized (lock) {
            view = txn != null && txn.clearAll ? new TreeMap<>() : new TreeMap<>(records);
        }
        if (txn != null) {
            view.keySet().removeAll(txn.deleted);
            view.putAll(txn.staged);
        }

        List<JobRecord> matching = new ArrayList<>();
        for (JobRecord record : view.values()) {
            if (predicate.test(record)) {
                matching.add(record.copy());
            }
        }
        return matching;
    }

    private MemoryTransaction unwrap(JobStoreTransaction tx) throws JobStoreException {
        if (tx == null) {
            return null;
        }
        if (!(tx instanceof MemoryTransaction) || ((MemoryTransaction) tx).owner() != this) {
            throw new IllegalArgumentException("Transaction does not belong to this store.");
        }
        MemoryTransaction txn = (MemoryTransaction) tx;
        if (txn.completed) {
            throw new JobStoreException("Transaction has already been committed or rolled back.");
        }
        return txn;
    }

    private final class MemoryTransaction implements JobStoreTransaction {
        private final Map<Long, JobRecord> staged = new LinkedHashMap<>();
        private final Set<Long> deleted = new HashSet<>();
        private boolean clearAll;
        private boolean completed;

        private MemoryJobStore owner() {
            return MemoryJobStore.this;
        }

        @Override
        public void commit() throws JobStoreException {
            complete();
            synchronized (lock) {
                if (clearAll) {
                    records.clear();
                }
                for (Long id : deleted) {
                    records.remove(id);
                }
                records.putAll(staged);
            }
        }

        @Override
        public void rollback() throws JobStoreException {
            complete();
            staged.clear();
            deleted.clear();
        }

        @Override
        public boolean isCompleted() {
            return completed;
        }

        private void complete() throws JobStoreException {
            if (completed) {
                throw new JobStoreException("Transaction has already been committed or rolled back.");
            }
            completed = true;
        }
    }
}
