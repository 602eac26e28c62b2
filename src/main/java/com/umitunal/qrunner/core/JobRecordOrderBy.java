package com.umitunal.qrunner.core;

import com.umitunal.qrunner.model.JobRecord;

import java.util.Comparator;

/**
 * Sort keys for paged job record queries.
 */
public enum JobRecordOrderBy {
    ID(Comparator.comparing(JobRecord::getId, Comparator.nullsFirst(Comparator.naturalOrder()))),
    NAME(Comparator.comparing(JobRecord::getName, Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER))),
    JOB_TYPE(Comparator.comparing(JobRecord::getJobType, Comparator.nullsFirst(Comparator.naturalOrder()))),
    STATUS(Comparator.comparing(JobRecord::getStatus)),
    SCHEDULE_NAME(Comparator.comparing(JobRecord::getScheduleName, Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER))),
    TRY_NUMBER(Comparator.comparingInt(JobRecord::getTryNumber)),
    QUEUE_DATE(Comparator.comparing(JobRecord::getQueueDate, Comparator.nullsFirst(Comparator.naturalOrder()))),
    START_DATE(Comparator.comparing(JobRecord::getStartDate, Comparator.nullsFirst(Comparator.naturalOrder()))),
    FINISH_DATE(Comparator.comparing(JobRecord::getFinishDate, Comparator.nullsFirst(Comparator.naturalOrder())));

    private final Comparator<JobRecord> comparator;

    JobRecordOrderBy(Comparator<JobRecord> comparator) {
        this.comparator = comparator;
    }

    /**
     * Comparator for this key, ties broken by id so paging is stable.
     */
    public Comparator<JobRecord> comparator(boolean descending) {
        Comparator<JobRecord> byKey = descending ? comparator.reversed() : comparator;
        return byKey.thenComparing(JobRecord::getId, Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
