package com.umitunal.qrunner.core;

/**
 * Raised when a job cannot be rebuilt from its type id and serialized data.
 */
public class JobLoadException extends Exception {
    private final String jobType;

    public JobLoadException(String jobType, String message) {
        super(message);
        this.jobType = jobType;
    }

    public JobLoadException(String jobType, String message, Throwable cause) {
        super(message, cause);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
