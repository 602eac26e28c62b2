package com.umitunal.qrunner.schedule;

import com.umitunal.qrunner.core.Job;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A recurring fire definition: jobs are created at {@code startOn + k * repeatInterval}.
 * A zero repeat interval fires once at {@code startOn}.
 */
public class Schedule {
    private final String name;
    private final Instant startOn;
    private final Duration repeatInterval;
    private final List<ScheduledJobDefinition> jobs;

    private Schedule(Builder builder) {
        this.name = builder.name;
        this.startOn = builder.startOn;
        this.repeatInterval = builder.repeatInterval;
        this.jobs = List.copyOf(builder.jobs);
    }

    public String getName() { return name; }
    public Instant getStartOn() { return startOn; }
    public Duration getRepeatInterval() { return repeatInterval; }
    public List<ScheduledJobDefinition> getJobs() { return jobs; }

    public static Builder newBuilder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "Schedule{name='" + name + "', startOn=" + startOn + ", repeat=" + repeatInterval
                + ", jobs=" + jobs.size() + "}";
    }

    public static class Builder {
        private final String name;
        private Instant startOn = Instant.EPOCH;
        private Duration repeatInterval = Duration.ZERO;
        private final List<ScheduledJobDefinition> jobs = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * First eligible fire time.
         * Default: the epoch
         */
        public Builder startOn(Instant startOn) {
            this.startOn = Objects.requireNonNull(startOn, "startOn");
            return this;
        }

        /**
         * Time between fires.
         * Default: zero (fire once)
         */
        public Builder repeatEvery(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("repeat interval must not be negative.");
            }
            this.repeatInterval = interval;
            return this;
        }

        /**
         * Fractional hours, as used by schedule configuration files.
         */
        public Builder repeatHours(double hours) {
            if (hours < 0 || Double.isNaN(hours) || Double.isInfinite(hours)) {
                throw new IllegalArgumentException("repeatHours must be a non-negative number.");
            }
            return repeatEvery(Duration.ofMillis(Math.round(hours * 3_600_000d)));
        }

        public Builder addJob(ScheduledJobDefinition definition) {
            jobs.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public Builder addJob(Class<? extends Job> jobClass) {
            return addJob(ScheduledJobDefinition.of(jobClass));
        }

        public Builder addJob(Class<? extends Job> jobClass, Map<String, String> properties) {
            return addJob(ScheduledJobDefinition.of(jobClass, properties));
        }

        public Schedule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Schedule name must contain a value.");
            }
            return new Schedule(this);
        }
    }
}
