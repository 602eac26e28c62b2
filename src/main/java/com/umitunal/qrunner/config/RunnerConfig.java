package com.umitunal.qrunner.config;

import com.umitunal.qrunner.schedule.Schedule;
import com.umitunal.qrunner.serialization.JsonCodec;
import com.umitunal.qrunner.serialization.PayloadCodec;
import com.umitunal.qrunner.worker.PersistedJobRun;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Construction parameters of a job runner.
 */
public class RunnerConfig {
    public static final String DEFAULT_PERSISTENCE_FILE = "qrunner-running.json";
    public static final long DEFAULT_HEARTBEAT = 10000;
    public static final int DEFAULT_MAXIMUM_CONCURRENCY = 25;
    public static final long DEFAULT_RETRY_TIMEOUT = 60000;

    private final Path persistencePath;
    private final boolean deleteRecordsOnSuccess;
    private final long heartbeat;
    private final int maximumConcurrency;
    private final long retryTimeout;
    private final List<Schedule> schedules;
    private final PayloadCodec<PersistedJobRun[]> recoveryCodec;

    private RunnerConfig(Builder builder) {
        this.persistencePath = builder.persistencePath.toAbsolutePath();
        this.deleteRecordsOnSuccess = builder.deleteRecordsOnSuccess;
        this.heartbeat = builder.heartbeat < 1 ? DEFAULT_HEARTBEAT : builder.heartbeat;
        this.maximumConcurrency = builder.maximumConcurrency < 1 ? DEFAULT_MAXIMUM_CONCURRENCY : builder.maximumConcurrency;
        this.retryTimeout = builder.retryTimeout < 1 ? DEFAULT_RETRY_TIMEOUT : builder.retryTimeout;
        this.schedules = List.copyOf(builder.schedules);
        this.recoveryCodec = builder.recoveryCodec != null
                ? builder.recoveryCodec
                : new JsonCodec<>(PersistedJobRun[].class);
    }

    public Path getPersistencePath() { return persistencePath; }
    public boolean isDeleteRecordsOnSuccess() { return deleteRecordsOnSuccess; }
    public long getHeartbeat() { return heartbeat; }
    public int getMaximumConcurrency() { return maximumConcurrency; }
    public long getRetryTimeout() { return retryTimeout; }
    public List<Schedule> getSchedules() { return schedules; }
    public PayloadCodec<PersistedJobRun[]> getRecoveryCodec() { return recoveryCodec; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static RunnerConfig defaults() {
        return newBuilder().build();
    }

    public static class Builder {
        private Path persistencePath = Path.of(DEFAULT_PERSISTENCE_FILE);
        private boolean deleteRecordsOnSuccess = false;
        private long heartbeat = DEFAULT_HEARTBEAT;
        private int maximumConcurrency = DEFAULT_MAXIMUM_CONCURRENCY;
        private long retryTimeout = DEFAULT_RETRY_TIMEOUT;
        private final List<Schedule> schedules = new ArrayList<>();
        private PayloadCodec<PersistedJobRun[]> recoveryCodec;

        private Builder() {
        }

        /**
         * File the running-jobs ledger is mirrored to. Relative paths resolve against
         * the working directory.
         * Default: qrunner-running.json
         */
        public Builder withPersistencePath(Path path) {
            this.persistencePath = Objects.requireNonNull(path, "path");
            return this;
        }

        /**
         * Delete records of succeeded jobs instead of keeping them.
         * Default: false
         */
        public Builder withDeleteRecordsOnSuccess(boolean delete) {
            this.deleteRecordsOnSuccess = delete;
            return this;
        }

        /**
         * Polling interval in milliseconds. Values below 1 use the default.
         * Default: 10000
         */
        public Builder withHeartbeat(long millis) {
            this.heartbeat = millis;
            return this;
        }

        /**
         * Maximum number of jobs executing at once. Values below 1 use the default.
         * Default: 25
         */
        public Builder withMaximumConcurrency(int count) {
            this.maximumConcurrency = count;
            return this;
        }

        /**
         * Delay in milliseconds before a retry of a failed or timed out job is dequeued.
         * Values below 1 use the default.
         * Default: 60000
         */
        public Builder withRetryTimeout(long millis) {
            this.retryTimeout = millis;
            return this;
        }

        public Builder withSchedules(Collection<Schedule> schedules) {
            this.schedules.clear();
            this.schedules.addAll(Objects.requireNonNull(schedules, "schedules"));
            return this;
        }

        public Builder addSchedule(Schedule schedule) {
            this.schedules.add(Objects.requireNonNull(schedule, "schedule"));
            return this;
        }

        /**
         * Codec of the recovery file.
         * Default: JSON
         */
        public Builder withRecoveryCodec(PayloadCodec<PersistedJobRun[]> codec) {
            this.recoveryCodec = codec;
            return this;
        }

        public RunnerConfig build() {
            return new RunnerConfig(this);
        }
    }
}
