package com.umitunal.qrunner.schedule;

import com.umitunal.qrunner.model.JobRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides when recurring schedules are due.
 *
 * Repeat boundaries are {@code startOn + k * repeatInterval} for k >= 0. The runner
 * samples time once per heartbeat, so a schedule counts as due when the current time
 * lies in {@code [boundary, boundary + window)} for the latest boundary not after now.
 */
public final class ScheduleEvaluator {

    private ScheduleEvaluator() {
    }

    public static boolean shouldExecute(Schedule schedule, long windowMillis, Instant now) {
        return dueInstant(schedule, windowMillis, now).isPresent();
    }

    /**
     * Gets the boundary the schedule is due for at {@code now}, if any.
     *
     * @param windowMillis tolerance window, normally the heartbeat
     */
    public static Optional<Instant> dueInstant(Schedule schedule, long windowMillis, Instant now) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(now, "now");
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window must be greater than 0.");
        }

        long start = schedule.getStartOn().toEpochMilli();
        long current = now.toEpochMilli();
        if (current < start) {
            return Optional.empty();
        }

        long repeat = schedule.getRepeatInterval().toMillis();
        long boundary = start;
        if (repeat > 0) {
            boundary = start + ((current - start) / repeat) * repeat;
        }

        return current - boundary < windowMillis
                ? Optional.of(Instant.ofEpochMilli(boundary))
                : Optional.empty();
    }

    /**
     * Expands schedules into one unevaluated tuple per job definition.
     */
    public static List<ScheduledJobTuple> expand(Collection<Schedule> schedules) {
        List<ScheduledJobTuple> tuples = new ArrayList<>();
        for (Schedule schedule : schedules) {
            for (ScheduledJobDefinition definition : schedule.getJobs()) {
                tuples.add(new ScheduledJobTuple(schedule, definition));
            }
        }
        return tuples;
    }

    /**
     * Gets the tuples that should fire now.
     *
     * Each tuple is joined with the latest record of its (schedule, job type) pair. A due
     * tuple is kept only if it never ran or last ran more than one window ago. Results
     * are ordered by last execution, never-run first, and capped at {@code maxCount}.
     */
    public static List<ScheduledJobTuple> getExecutableTuples(Collection<ScheduledJobTuple> tuples,
                                                              Collection<JobRecord> latestRecords,
                                                              Instant now,
                                                              long windowMillis,
                                                              int maxCount) {
        Objects.requireNonNull(tuples, "tuples");
        if (maxCount <= 0) {
            return List.of();
        }

        List<ScheduledJobTuple> executable = new ArrayList<>();
        for (ScheduledJobTuple tuple : tuples) {
            Instant lastExecuted = latestFor(tuple, latestRecords);
            Optional<Instant> due = dueInstant(tuple.getSchedule(), windowMillis, now);

            if (due.isPresent() && (lastExecuted == null || now.toEpochMilli() - lastExecuted.toEpochMilli() > windowMillis)) {
                executable.add(new ScheduledJobTuple(tuple.getSchedule(), tuple.getDefinition(), lastExecuted, due.get()));
            }
        }

        executable.sort(Comparator.comparing(ScheduledJobTuple::getLastExecuted,
                Comparator.nullsFirst(Comparator.naturalOrder())));

        return executable.size() > maxCount ? List.copyOf(executable.subList(0, maxCount)) : executable;
    }

    private static Instant latestFor(ScheduledJobTuple tuple, Collection<JobRecord> records) {
        Instant latest = null;
        if (records == null) {
            return null;
        }
        for (JobRecord record : records) {
            if (tuple.matches(record) && (latest == null || record.getQueueDate().isAfter(latest))) {
                latest = record.getQueueDate();
            }
        }
        return latest;
    }
}
