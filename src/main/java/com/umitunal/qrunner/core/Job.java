package com.umitunal.qrunner.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qrunner.model.JobRecord;
import com.umitunal.qrunner.serialization.JsonCodec;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work that can be persisted, dequeued and executed by the runner.
 *
 * Job state is the set of instance fields of the concrete class; it is written to
 * {@code JobRecord.data} as JSON and bound back onto a fresh instance when the job
 * is dequeued. Subclasses need a no-argument constructor registered with a
 * {@link JobRegistry}.
 */
public abstract class Job {
    public static final int DEFAULT_RETRIES = 0;
    public static final long DEFAULT_TIMEOUT = 60000;

    private static final ObjectMapper MAPPER = JsonCodec.createFieldMapper();

    @JsonIgnore
    private int tryNumber = 1;

    /**
     * Gets the display name of this job.
     */
    public abstract String getName();

    /**
     * Gets how many times a failed or timed out attempt is retried.
     */
    public int getRetries() {
        return DEFAULT_RETRIES;
    }

    /**
     * Gets the maximum run time in milliseconds before the runner aborts the job.
     */
    public long getTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Gets the current attempt number (1-based).
     */
    public int getTryNumber() {
        return tryNumber;
    }

    public void setTryNumber(int tryNumber) {
        if (tryNumber < 1) {
            throw new IllegalArgumentException("tryNumber must be greater than 0.");
        }
        this.tryNumber = tryNumber;
    }

    /**
     * Gets the stable type id stored with records of this job.
     */
    public String getJobType() {
        return typeIdOf(getClass());
    }

    /**
     * Runs the job. Implementations should check the token between units of work and
     * return, or throw, once a stop is requested. The running thread is also interrupted.
     *
     * @throws Exception to mark the attempt as failed
     */
    public abstract void execute(CancellationToken token) throws Exception;

    /**
     * Serializes the job state to JSON.
     */
    public String serialize() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + getJobType(), e);
        }
    }

    /**
     * Creates a new, unsaved, queued record for this job.
     */
    public JobRecord createRecord() {
        JobRecord record = new JobRecord();
        record.setName(getName());
        record.setJobType(getJobType());
        record.setData(serialize());
        record.setStatus(JobStatus.QUEUED);
        record.setQueueDate(Instant.now());
        record.setTryNumber(tryNumber);
        return record;
    }

    /**
     * Creates a queued record for this job and saves it to the store.
     *
     * @return the saved record, with its id assigned
     */
    public JobRecord enqueue(JobStore store) throws JobStoreException {
        Objects.requireNonNull(store, "store");
        JobRecord record = createRecord();
        store.saveJob(record);
        return record;
    }

    /**
     * Type id for a job class: its {@link JobType} value, or its class name.
     */
    public static String typeIdOf(Class<?> jobClass) {
        JobType annotation = jobClass.getAnnotation(JobType.class);
        return annotation != null ? annotation.value() : jobClass.getName();
    }

    static <T extends Job> T bind(T job, String data) throws IOException {
        if (data == null || data.isBlank()) {
            return job;
        }
        return MAPPER.readerForUpdating(job).readValue(data);
    }
}
