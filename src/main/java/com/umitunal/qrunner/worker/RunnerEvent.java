package com.umitunal.qrunner.worker;

import com.umitunal.qrunner.model.JobRecord;

import java.util.Objects;

/**
 * Notification published by a {@link JobRunner}.
 */
public final class RunnerEvent {

    public enum Type {
        ALL_FINISHED,
        CANCEL_JOB,
        DEQUEUE_JOB,
        ERROR,
        EXECUTE_SCHEDULED_JOB,
        FINISH_JOB,
        RETRY_ENQUEUED,
        TIMEOUT_JOB
    }

    private final Type type;
    private final JobRecord record;
    private final Throwable error;

    private RunnerEvent(Type type, JobRecord record, Throwable error) {
        this.type = Objects.requireNonNull(type, "type");
        this.record = record;
        this.error = error;
    }

    public static RunnerEvent of(Type type, JobRecord record) {
        return new RunnerEvent(type, record == null ? null : record.copy(), null);
    }

    public static RunnerEvent allFinished() {
        return new RunnerEvent(Type.ALL_FINISHED, null, null);
    }

    /**
     * @param record the affected record, or null for loop-level failures
     */
    public static RunnerEvent error(JobRecord record, Throwable error) {
        return new RunnerEvent(Type.ERROR, record == null ? null : record.copy(), error);
    }

    public Type getType() {
        return type;
    }

    public JobRecord getRecord() {
        return record;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "RunnerEvent{" + type + (record != null ? ", " + record : "")
                + (error != null ? ", error=" + error : "") + "}";
    }
}
