package com.umitunal.qrunner.model;

import com.umitunal.qrunner.core.JobStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted representation of one job attempt.
 * A record without an id has not been saved yet; the store assigns the id on first save.
 */
public class JobRecord {
    private Long id;
    private String name;
    private String jobType;
    private String data;
    private JobStatus status;
    private String scheduleName;
    private int tryNumber;
    private Instant queueDate;
    private Instant startDate;
    private Instant finishDate;
    private String exception;

    public JobRecord() {
        this.status = JobStatus.QUEUED;
        this.tryNumber = 1;
        this.queueDate = Instant.now();
    }

    public Long getId() {
        return id;
    }

    /**
     * Assigns the store identity. Once set, the id can only be "set" to the same value.
     */
    public void setId(Long id) {
        if (this.id != null && !this.id.equals(id)) {
            throw new IllegalStateException("Job record id is immutable once assigned: " + this.id);
        }
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public void setScheduleName(String scheduleName) {
        this.scheduleName = scheduleName;
    }

    public int getTryNumber() {
        return tryNumber;
    }

    public void setTryNumber(int tryNumber) {
        if (tryNumber < 1) {
            throw new IllegalArgumentException("tryNumber must be greater than 0.");
        }
        this.tryNumber = tryNumber;
    }

    public Instant getQueueDate() {
        return queueDate;
    }

    public void setQueueDate(Instant queueDate) {
        this.queueDate = Objects.requireNonNull(queueDate, "queueDate");
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = startDate;
    }

    public Instant getFinishDate() {
        return finishDate;
    }

    public void setFinishDate(Instant finishDate) {
        this.finishDate = finishDate;
    }

    public String getException() {
        return exception;
    }

    public void setException(String exception) {
        this.exception = exception;
    }

    /**
     * Field-by-field copy, used by stores that must not share instances with callers.
     */
    public JobRecord copy() {
        JobRecord copy = new JobRecord();
        copy.id = id;
        copy.name = name;
        copy.jobType = jobType;
        copy.data = data;
        copy.status = status;
        copy.scheduleName = scheduleName;
        copy.tryNumber = tryNumber;
        copy.queueDate = queueDate;
        copy.startDate = startDate;
        copy.finishDate = finishDate;
        copy.exception = exception;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id=%s, name='%s', type='%s', status=%s, try=%d, schedule=%s}",
                id, name, jobType, status, tryNumber, scheduleName);
    }
}
