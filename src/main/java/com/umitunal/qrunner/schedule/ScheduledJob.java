package com.umitunal.qrunner.schedule;

import com.umitunal.qrunner.core.Job;

import java.util.HashMap;
import java.util.Map;

/**
 * Base class for jobs created by a schedule. Receives the string properties of its
 * {@link ScheduledJobDefinition} before it is executed; they are persisted with the
 * rest of the job state.
 */
public abstract class ScheduledJob extends Job {
    private Map<String, String> properties = new HashMap<>();

    public Map<String, String> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, String> properties) {
        this.properties = properties == null ? new HashMap<>() : new HashMap<>(properties);
    }

    protected String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }
}
