package com.umitunal.qrunner.core;

import com.umitunal.qrunner.model.JobRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Transactional persistence of job records.
 *
 * Every operation takes an optional transaction. A null transaction means the
 * operation runs on its own and is committed immediately. Records returned by a
 * store are detached copies; changes must be written back with {@link #saveJob}.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Begins a new transaction. Closing it without commit or rollback commits it.
     */
    JobStoreTransaction beginTransaction() throws JobStoreException;

    /**
     * Inserts the record when it has no id (assigning one), otherwise updates it by id.
     */
    void saveJob(JobRecord record, JobStoreTransaction tx) throws JobStoreException;

    default void saveJob(JobRecord record) throws JobStoreException {
        saveJob(record, null);
    }

    /**
     * @return the record, or null if no record has the id
     */
    JobRecord getJob(long id, JobStoreTransaction tx) throws JobStoreException;

    default JobRecord getJob(long id) throws JobStoreException {
        return getJob(id, null);
    }

    /**
     * Gets the records with the given ids, ordered by id. Unknown ids are skipped.
     */
    List<JobRecord> getJobs(Collection<Long> ids, JobStoreTransaction tx) throws JobStoreException;

    /**
     * Gets records with the given status queued at or before {@code before},
     * ordered by queue date ascending.
     *
     * @param maxCount maximum number of records; 0 or less for all
     */
    List<JobRecord> getJobs(JobStatus status, int maxCount, Instant before, JobStoreTransaction tx)
            throws JobStoreException;

    default List<JobRecord> getJobs(JobStatus status, int maxCount, Instant before) throws JobStoreException {
        return getJobs(status, maxCount, before, null);
    }

    /**
     * Filtered, ordered, paged query. Null filters match everything; {@code likeName}
     * is a case-insensitive contains match and {@code scheduleName} a case-insensitive
     * equality match.
     *
     * @param page 1-based page number
     */
    List<JobRecord> getJobs(String likeName, JobStatus status, String scheduleName,
                            JobRecordOrderBy orderBy, boolean descending, int page, int pageSize,
                            JobStoreTransaction tx) throws JobStoreException;

    /**
     * Counts records matching the same filters as the paged query.
     */
    long getJobCount(String likeName, JobStatus status, String scheduleName, JobStoreTransaction tx)
            throws JobStoreException;

    /**
     * Gets the most recently queued record for each (schedule, job type) pair of the
     * given schedules.
     */
    List<JobRecord> getLatestScheduledJobs(Collection<String> scheduleNames, JobStoreTransaction tx)
            throws JobStoreException;

    void deleteJob(long id, JobStoreTransaction tx) throws JobStoreException;

    default void deleteJob(long id) throws JobStoreException {
        deleteJob(id, null);
    }

    void deleteAllJobs(JobStoreTransaction tx) throws JobStoreException;

    /**
     * Deletes records queued before {@code olderThan} that are not in flight.
     *
     * @return number of deleted records
     */
    long deleteJobs(Instant olderThan, JobStoreTransaction tx) throws JobStoreException;

    @Override
    void close() throws JobStoreException;
}
