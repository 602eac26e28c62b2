package com.umitunal.qrunner.storage;

import com.umitunal.qrunner.core.JobRecordOrderBy;
import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.model.JobRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Query semantics shared by the store adapters. Both adapters scan their records and
 * delegate filtering, ordering and paging here so they answer queries identically.
 */
final class JobQueries {

    private JobQueries() {
    }

    static Predicate<JobRecord> filter(String likeName, JobStatus status, String scheduleName) {
        String needle = likeName == null || likeName.isEmpty() ? null : likeName.toLowerCase(Locale.ROOT);
        return record -> (needle == null
                        || (record.getName() != null && record.getName().toLowerCase(Locale.ROOT).contains(needle)))
                && (status == null || record.getStatus() == status)
                && (scheduleName == null || scheduleName.equalsIgnoreCase(record.getScheduleName()));
    }

    static Predicate<JobRecord> queuedBy(JobStatus status, Instant before) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(before, "before");
        return record -> record.getStatus() == status && !record.getQueueDate().isAfter(before);
    }

    static Predicate<JobRecord> purgeable(Instant olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        return record -> record.getQueueDate().isBefore(olderThan) && !record.getStatus().isInFlight();
    }

    static List<JobRecord> oldestFirst(List<JobRecord> records, int maxCount) {
        List<JobRecord> sorted = new ArrayList<>(records);
        sorted.sort(JobRecordOrderBy.QUEUE_DATE.comparator(false));
        return maxCount > 0 && sorted.size() > maxCount ? new ArrayList<>(sorted.subList(0, maxCount)) : sorted;
    }

    static List<JobRecord> page(List<JobRecord> records, JobRecordOrderBy orderBy, boolean descending,
                                int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be greater than 0.");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be greater than 0.");
        }
        JobRecordOrderBy order = orderBy == null ? JobRecordOrderBy.QUEUE_DATE : orderBy;

        return records.stream()
                .sorted(order.comparator(descending))
                .skip((long) (page - 1) * pageSize)
                .limit(pageSize)
                .collect(Collectors.toList());
    }

    static Predicate<JobRecord> inSchedules(Collection<String> scheduleNames) {
        Set<String> names = new HashSet<>();
        for (String name : scheduleNames) {
            if (name != null) {
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }
        return record -> record.getScheduleName() != null
                && names.contains(record.getScheduleName().toLowerCase(Locale.ROOT));
    }

    /**
     * Keeps the most recently queued record of each (schedule, job type) pair.
     */
    static List<JobRecord> latestPerScheduleAndType(List<JobRecord> records) {
        Comparator<JobRecord> newest = JobRecordOrderBy.QUEUE_DATE.comparator(false);
        Map<String, JobRecord> latest = new LinkedHashMap<>();
        for (JobRecord record : records) {
            String key = record.getScheduleName().toLowerCase(Locale.ROOT) + '\u0000' + record.getJobType();
            latest.merge(key, record, (a, b) -> newest.compare(a, b) >= 0 ? a : b);
        }
        return new ArrayList<>(latest.values());
    }
}
