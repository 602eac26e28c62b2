package com.umitunal.qrunner.schedule;

import com.umitunal.qrunner.core.Job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A job type to instantiate each time its schedule fires, with optional string properties.
 */
public class ScheduledJobDefinition {
    private final String jobType;
    private final Map<String, String> properties;

    public ScheduledJobDefinition(String jobType) {
        this(jobType, Map.of());
    }

    public ScheduledJobDefinition(String jobType, Map<String, String> properties) {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType must contain a value.");
        }
        this.jobType = jobType;
        this.properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static ScheduledJobDefinition of(Class<? extends Job> jobClass) {
        return new ScheduledJobDefinition(Job.typeIdOf(jobClass));
    }

    public static ScheduledJobDefinition of(Class<? extends Job> jobClass, Map<String, String> properties) {
        return new ScheduledJobDefinition(Job.typeIdOf(jobClass), properties);
    }

    public String getJobType() {
        return jobType;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledJobDefinition)) return false;
        ScheduledJobDefinition that = (ScheduledJobDefinition) o;
        return jobType.equals(that.jobType) && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobType, properties);
    }

    @Override
    public String toString() {
        return "ScheduledJobDefinition{type='" + jobType + "', properties=" + properties + "}";
    }
}
