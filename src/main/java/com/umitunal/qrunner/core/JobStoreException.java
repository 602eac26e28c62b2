package com.umitunal.qrunner.core;

/**
 * Raised when a {@link JobStore} cannot read or write job records.
 */
public class JobStoreException extends Exception {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
