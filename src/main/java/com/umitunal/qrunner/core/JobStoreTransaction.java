package com.umitunal.qrunner.core;

/**
 * A unit of work against a {@link JobStore}.
 *
 * Closing a transaction that was neither committed nor rolled back commits it,
 * so {@code try (JobStoreTransaction tx = store.beginTransaction())} blocks only
 * need an explicit rollback on failure.
 */
public interface JobStoreTransaction extends AutoCloseable {

    void commit() throws JobStoreException;

    void rollback() throws JobStoreException;

    /**
     * Checks whether commit or rollback has already been called.
     */
    boolean isCompleted();

    @Override
    default void close() throws JobStoreException {
        if (!isCompleted()) {
            commit();
        }
    }
}
