package com.umitunal.qrunner.core;

import com.umitunal.qrunner.model.JobRecord;
import com.umitunal.qrunner.schedule.ScheduledJob;
import com.umitunal.qrunner.schedule.ScheduledJobDefinition;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps stable job type ids to constructor functions.
 *
 * Populated at startup; the runner uses it to rebuild jobs from persisted records
 * and to instantiate scheduled jobs.
 */
public class JobRegistry {
    private final Map<String, Supplier<? extends Job>> factories = new ConcurrentHashMap<>();

    /**
     * Registers a job class under its type id ({@link JobType} value or class name).
     *
     * @return this registry
     */
    public <T extends Job> JobRegistry register(Class<T> jobClass, Supplier<T> factory) {
        Objects.requireNonNull(jobClass, "jobClass");
        return register(Job.typeIdOf(jobClass), factory);
    }

    public JobRegistry register(String jobType, Supplier<? extends Job> factory) {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(factory, "factory");
        factories.put(jobType, factory);
        return this;
    }

    public boolean isRegistered(String jobType) {
        return jobType != null && factories.containsKey(jobType);
    }

    public Set<String> getJobTypes() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Creates a fresh job of the given type and binds the serialized state onto it.
     */
    public Job deserialize(String jobType, String data) throws JobLoadException {
        Job job = newInstance(jobType);
        try {
            return Job.bind(job, data);
        } catch (IOException e) {
            throw new JobLoadException(jobType, "Failed to bind job data for type " + jobType, e);
        }
    }

    /**
     * Rebuilds the job of a persisted record, including its try number.
     */
    public Job toJob(JobRecord record) throws JobLoadException {
        Objects.requireNonNull(record, "record");
        Job job = deserialize(record.getJobType(), record.getData());
        job.setTryNumber(record.getTryNumber());
        return job;
    }

    /**
     * Instantiates the job of a schedule definition and hands it the definition's properties.
     */
    public Job create(ScheduledJobDefinition definition) throws JobLoadException {
        Objects.requireNonNull(definition, "definition");
        Job job = newInstance(definition.getJobType());
        if (job instanceof ScheduledJob) {
            ((ScheduledJob) job).setProperties(definition.getProperties());
        }
        return job;
    }

    private Job newInstance(String jobType) throws JobLoadException {
        Supplier<? extends Job> factory = jobType == null ? null : factories.get(jobType);
        if (factory == null) {
            throw new JobLoadException(jobType, "Unknown job type: " + jobType);
        }
        Job job;
        try {
            job = factory.get();
        } catch (RuntimeException e) {
            throw new JobLoadException(jobType, "Failed to create job of type " + jobType, e);
        }
        if (job == null) {
            throw new JobLoadException(jobType, "Factory returned no job for type " + jobType);
        }
        return job;
    }
}
