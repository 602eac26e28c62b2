package com.umitunal.qrunner.schedule;

import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.model.JobRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * One (schedule, job definition) pair, optionally evaluated against a point in time.
 */
public class ScheduledJobTuple {
    private final Schedule schedule;
    private final ScheduledJobDefinition definition;
    private final Instant lastExecuted;
    private final Instant executeOn;

    public ScheduledJobTuple(Schedule schedule, ScheduledJobDefinition definition) {
        this(schedule, definition, null, null);
    }

    ScheduledJobTuple(Schedule schedule, ScheduledJobDefinition definition, Instant lastExecuted, Instant executeOn) {
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.lastExecuted = lastExecuted;
        this.executeOn = executeOn;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public ScheduledJobDefinition getDefinition() {
        return definition;
    }

    /**
     * Queue date of the latest record of this pair, or null if it never ran.
     */
    public Instant getLastExecuted() {
        return lastExecuted;
    }

    /**
     * The repeat boundary that made this tuple due, or null if it is not due.
     */
    public Instant getExecuteOn() {
        return executeOn;
    }

    public boolean shouldExecute() {
        return executeOn != null;
    }

    /**
     * Creates the STARTED record for one firing of this tuple. Name and data are filled
     * in by the caller once the job is instantiated.
     */
    public JobRecord createRecord(Instant now) {
        JobRecord record = new JobRecord();
        record.setName(definition.getJobType());
        record.setJobType(definition.getJobType());
        record.setScheduleName(schedule.getName());
        record.setStatus(JobStatus.STARTED);
        record.setQueueDate(now);
        record.setStartDate(now);
        return record;
    }

    boolean matches(JobRecord record) {
        return schedule.getName().equalsIgnoreCase(record.getScheduleName())
                && definition.getJobType().equals(record.getJobType());
    }

    @Override
    public String toString() {
        return "ScheduledJobTuple{schedule='" + schedule.getName() + "', type='" + definition.getJobType()
                + "', lastExecuted=" + lastExecuted + ", executeOn=" + executeOn + "}";
    }
}
