package com.umitunal.qrunner.worker;

import com.umitunal.qrunner.config.RunnerConfig;
import com.umitunal.qrunner.core.Job;
import com.umitunal.qrunner.core.JobLoadException;
import com.umitunal.qrunner.core.JobRegistry;
import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.core.JobStore;
import com.umitunal.qrunner.core.JobStoreException;
import com.umitunal.qrunner.core.JobStoreTransaction;
import com.umitunal.qrunner.model.JobRecord;
import com.umitunal.qrunner.schedule.Schedule;
import com.umitunal.qrunner.schedule.ScheduleEvaluator;
import com.umitunal.qrunner.schedule.ScheduledJobTuple;
import com.umitunal.qrunner.serialization.ErrorDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Polls a job store on a fixed heartbeat and executes jobs.
 *
 * Each heartbeat runs, in order: cancel, timeout, finish, and, while the runner is
 * accepting work, scheduled execution and dequeue. Every phase works inside one store
 * transaction. Runs added by a phase are written to the running-jobs ledger before the
 * commit and taken out again if the phase rolls back; runs removed by a phase leave the
 * ledger only after the commit. Events are published once their phase has committed.
 *
 * A runner assumes it is the only runner working against its store.
 */
public class JobRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final long JOIN_TIMEOUT_MILLIS = 5000;

    private final Object stateLock = new Object();
    private final Object runLock = new Object();
    private final JobStore store;
    private final JobRegistry registry;
    private final RunningJobs runs;
    private final List<RunnerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final List<RunnerEvent> pendingEvents = new ArrayList<>();

    private boolean deleteRecordsOnSuccess;
    private long heartbeat;
    private int maximumConcurrency;
    private long retryTimeout;
    private List<Schedule> schedules;
    private List<ScheduledJobTuple> scheduledJobs;
    private boolean running;
    private boolean shuttingDown;
    private Thread loopThread;

    // control thread only
    private Instant lastScheduleCheck;

    public JobRunner(JobStore store, JobRegistry registry) {
        this(store, registry, RunnerConfig.defaults());
    }

    public JobRunner(JobStore store, JobRegistry registry, RunnerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(config, "config");
        this.runs = new RunningJobs(config.getPersistencePath(), registry, config.getRecoveryCodec());
        this.deleteRecordsOnSuccess = config.isDeleteRecordsOnSuccess();
        this.heartbeat = config.getHeartbeat();
        this.maximumConcurrency = config.getMaximumConcurrency();
        this.retryTimeout = config.getRetryTimeout();
        setSchedules(config.getSchedules());
    }

    /**
     * Starts the control loop, or resumes dequeuing after {@link #pause()}.
     * Ignored while a safe stop is draining.
     */
    public void start() {
        synchronized (stateLock) {
            if (shuttingDown) {
                log.warn("Job runner is shutting down, start ignored");
                return;
            }
            running = true;

            if (loopThread == null || !loopThread.isAlive()) {
                loopThread = new Thread(this::runLoop, "job-runner");
                loopThread.setDaemon(false);
                loopThread.start();
            }
        }
        log.info("Job runner started (heartbeat {} ms, concurrency {})", getHeartbeat(), getMaximumConcurrency());
    }

    /**
     * Stops the runner.
     *
     * @param safely if true, stop taking new work and let running jobs finish, then
     *               publish ALL_FINISHED and end the loop; if false, abort running jobs,
     *               mark their records interrupted and end the loop now
     */
    public void stop(boolean safely) {
        boolean abort = false;
        boolean drainWithoutLoop = false;
        Thread loop;

        synchronized (stateLock) {
            if (!safely || !shuttingDown) {
                shuttingDown = true;
                running = false;
                abort = !safely;
            }
            loop = loopThread;
            if (abort) {
                loopThread = null;
            } else if (loop == null || !loop.isAlive()) {
                shuttingDown = false;
                drainWithoutLoop = true;
            }
        }

        if (drainWithoutLoop) {
            log.info("Job runner stopped");
            queueEvent(RunnerEvent.allFinished());
            publishPending();
            return;
        }

        if (!abort) {
            log.info("Job runner stopping once {} running jobs finish", getExecutingJobCount());
            return;
        }

        log.info("Job runner stopping, aborting {} running jobs", getExecutingJobCount());
        synchronized (runLock) {
            abortAndInterrupt();
        }
        publishPending();

        if (loop != null && loop != Thread.currentThread()) {
            loop.interrupt();
            try {
                loop.join(JOIN_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loop.isAlive()) {
                log.warn("Job runner loop did not end within {} ms", JOIN_TIMEOUT_MILLIS);
            }
        }

        synchronized (stateLock) {
            shuttingDown = false;
        }
        log.info("Job runner stopped");
    }

    /**
     * Stops taking new work. Running jobs continue and are still reconciled.
     */
    public void pause() {
        synchronized (stateLock) {
            running = false;
        }
        log.info("Job runner paused");
    }

    /**
     * Replaces the recurring schedules.
     */
    public void setSchedules(Collection<Schedule> schedules) {
        synchronized (stateLock) {
            this.schedules = schedules == null ? List.of() : List.copyOf(schedules);
            this.scheduledJobs = null;
        }
    }

    public List<Schedule> getSchedules() {
        synchronized (stateLock) {
            return schedules;
        }
    }

    /**
     * All (schedule, job definition) pairs of the current schedules.
     */
    public List<ScheduledJobTuple> getScheduledJobs() {
        synchronized (stateLock) {
            if (scheduledJobs == null) {
                scheduledJobs = List.copyOf(ScheduleEvaluator.expand(schedules));
            }
            return scheduledJobs;
        }
    }

    public void addListener(RunnerEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RunnerEventListener listener) {
        listeners.remove(listener);
    }

    public boolean isDeleteRecordsOnSuccess() {
        synchronized (stateLock) {
            return deleteRecordsOnSuccess;
        }
    }

    public void setDeleteRecordsOnSuccess(boolean deleteRecordsOnSuccess) {
        synchronized (stateLock) {
            this.deleteRecordsOnSuccess = deleteRecordsOnSuccess;
        }
    }

    public long getHeartbeat() {
        synchronized (stateLock) {
            return heartbeat;
        }
    }

    public void setHeartbeat(long heartbeat) {
        if (heartbeat < 1) {
            throw new IllegalArgumentException("heartbeat must be greater than 0.");
        }
        synchronized (stateLock) {
            this.heartbeat = heartbeat;
        }
    }

    public int getMaximumConcurrency() {
        synchronized (stateLock) {
            return maximumConcurrency;
        }
    }

    public void setMaximumConcurrency(int maximumConcurrency) {
        if (maximumConcurrency < 0) {
            throw new IllegalArgumentException("maximumConcurrency must be greater than or equal to 0.");
        }
        synchronized (stateLock) {
            this.maximumConcurrency = maximumConcurrency;
        }
    }

    public long getRetryTimeout() {
        synchronized (stateLock) {
            return retryTimeout;
        }
    }

    public void setRetryTimeout(long retryTimeout) {
        if (retryTimeout < 0) {
            throw new IllegalArgumentException("retryTimeout must be greater than or equal to 0.");
        }
        synchronized (stateLock) {
            this.retryTimeout = retryTimeout;
        }
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return running;
        }
    }

    public boolean isShuttingDown() {
        synchronized (stateLock) {
            return shuttingDown;
        }
    }

    /**
     * Number of runs in the ledger, i.e. started and not yet reconciled.
     */
    public int getExecutingJobCount() {
        return runs.count();
    }

    @Override
    public void close() {
        stop(false);
    }

    private boolean isCurrentLoop(Thread thread) {
        synchronized (stateLock) {
            return loopThread == thread;
        }
    }

    private void runLoop() {
        Thread self = Thread.currentThread();

        synchronized (runLock) {
            try {
                cleanupRecoveredJobs();
            } catch (Exception e) {
                log.error("Failed to clean up recovered jobs", e);
                queueEvent(RunnerEvent.error(null, e));
            }
        }
        publishPending();

        while (isCurrentLoop(self)) {
            boolean finished = false;

            try {
                synchronized (runLock) {
                    if (!isCurrentLoop(self)) {
                        break;
                    }
                    cancelJobs();
                    timeoutJobs();
                    finishJobs();

                    boolean accepting;
                    boolean draining;
                    synchronized (stateLock) {
                        accepting = running;
                        draining = shuttingDown;
                    }

                    if (accepting) {
                        executeScheduledJobs();
                        dequeueJobs();
                    } else if (draining && runs.count() == 0) {
                        synchronized (stateLock) {
                            shuttingDown = false;
                            loopThread = null;
                        }
                        log.info("All jobs finished, job runner stopped");
                        queueEvent(RunnerEvent.allFinished());
                        finished = true;
                    }
                }
            } catch (Exception e) {
                log.error("Job runner heartbeat failed", e);
                queueEvent(RunnerEvent.error(null, e));
            }

            publishPending();
            if (finished) {
                break;
            }

            try {
                Thread.sleep(getHeartbeat());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Job runner loop ended");
    }

    private void cleanupRecoveredJobs() throws JobStoreException, IOException {
        List<JobRun> recovered = runs.getAll().stream()
                .filter(JobRun::wasRecovered)
                .collect(Collectors.toList());
        if (recovered.isEmpty()) {
            return;
        }

        int interrupted = 0;
        JobStoreTransaction tx = store.beginTransaction();
        try {
            Map<Long, JobRecord> records = recordsFor(recovered, tx);
            for (JobRun run : recovered) {
                JobRecord record = records.get(run.getJobId());
                if (record == null || !record.getStatus().isInFlight()) {
                    continue;
                }
                record.setStatus(JobStatus.INTERRUPTED);
                record.setFinishDate(run.getFinishDate());
                if (run.hasExecutionError()) {
                    record.setException(run.getExecutionError());
                }
                store.saveJob(record, tx);
                interrupted++;
            }
            tx.commit();
        } catch (JobStoreException | RuntimeException e) {
            rollback(tx, e);
            throw e;
        }

        for (JobRun run : recovered) {
            runs.remove(run.getJobId());
        }
        runs.flush();
        log.info("Marked {} of {} recovered jobs as interrupted", interrupted, recovered.size());
    }

    private void cancelJobs() throws JobStoreException, IOException {
        List<JobRun> candidates = runs.getAll();
        if (candidates.isEmpty()) {
            return;
        }

        List<RunnerEvent> events = new ArrayList<>();
        List<Long> removals = new ArrayList<>();
        JobStoreTransaction tx = store.beginTransaction();
        try {
            Map<Long, JobRecord> records = recordsFor(candidates, tx);
            for (JobRun run : candidates) {
                JobRecord record = records.get(run.getJobId());
                if (record == null || record.getStatus() != JobStatus.CANCELING) {
                    continue;
                }
                run.abort();
                record.setStatus(JobStatus.CANCELED);
                record.setFinishDate(run.getFinishDate() != null ? run.getFinishDate() : Instant.now());
                store.saveJob(record, tx);

                removals.add(run.getJobId());
                events.add(RunnerEvent.of(RunnerEvent.Type.CANCEL_JOB, record));
                log.debug("Canceled job {}", record.getId());
            }
            tx.commit();
        } catch (JobStoreException | RuntimeException e) {
            rollback(tx, e);
            throw e;
        }

        removeAndFlush(removals);
        queueEvents(events);
    }

    private void timeoutJobs() throws JobStoreException, IOException {
        Instant now = Instant.now();
        List<JobRun> candidates = runs.getAll().stream()
                .filter(run -> !run.wasRecovered() && run.getJob() != null)
                .filter(run -> run.isAborted()
                        || (run.isRunning() && run.elapsed(now).toMillis() >= run.getJob().getTimeout()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return;
        }

        List<RunnerEvent> events = new ArrayList<>();
        List<Long> removals = new ArrayList<>();
        JobStoreTransaction tx = store.beginTransaction();
        try {
            Map<Long, JobRecord> records = recordsFor(candidates, tx);
            for (JobRun run : candidates) {
                JobRecord record = records.get(run.getJobId());
                if (record == null || record.getStatus() != JobStatus.STARTED) {
                    continue;
                }
                if (run.abort() || run.isAborted()) {
                    record.setStatus(JobStatus.TIMED_OUT);
                    record.setFinishDate(run.getFinishDate());
                    store.saveJob(record, tx);

                    removals.add(run.getJobId());
                    enqueueForRetry(run.getJob(), tx, events);
                    events.add(RunnerEvent.of(RunnerEvent.Type.TIMEOUT_JOB, record));
                    log.debug("Job {} timed out after {} ms", record.getId(), run.getJob().getTimeout());
                }
            }
            tx.commit();
        } catch (JobStoreException | RuntimeException e) {
            rollback(tx, e);
            throw e;
        }

        removeAndFlush(removals);
        queueEvents(events);
    }

    private void finishJobs() throws JobStoreException, IOException {
        List<JobRun> finished = runs.getNotRunning().stream()
                .filter(run -> !run.isAborted())
                .collect(Collectors.toList());
        finishRuns(finished);
    }

    /**
     * Writes the outcome of naturally finished runs to their records.
     */
    private void finishRuns(List<JobRun> finished) throws JobStoreException, IOException {
        if (finished.isEmpty()) {
            return;
        }

        List<RunnerEvent> events = new ArrayList<>();
        List<Long> removals = new ArrayList<>();
        JobStoreTransaction tx = store.beginTransaction();
        try {
            Map<Long, JobRecord> records = recordsFor(finished, tx);
            for (JobRun run : finished) {
                JobRecord record = records.get(run.getJobId());
                if (record == null || record.getStatus() != JobStatus.STARTED) {
                    if (record != null && record.getStatus() == JobStatus.CANCELING) {
                        continue;
                    }
                    log.warn("Dropping finished run of job {}: record is {}", run.getJobId(),
                            record == null ? "missing" : record.getStatus());
                    removals.add(run.getJobId());
                    continue;
                }
                finishRun(run, record, tx, events);
                removals.add(run.getJobId());
            }
            tx.commit();
        } catch (JobStoreException | RuntimeException e) {
            rollback(tx, e);
            throw e;
        }

        removeAndFlush(removals);
        queueEvents(events);
    }

    private void finishRun(JobRun run, JobRecord record, JobStoreTransaction tx, List<RunnerEvent> events)
            throws JobStoreException {
        record.setFinishDate(run.getFinishDate());

        if (run.wasRecovered()) {
            record.setStatus(JobStatus.INTERRUPTED);
            if (run.hasExecutionError()) {
                record.setException(run.getExecutionError());
            }
        } else if (run.getExecutionException() != null) {
            record.setStatus(JobStatus.FAILED);
            record.setException(run.getExecutionError());
            events.add(RunnerEvent.error(record, run.getExecutionException()));
            enqueueForRetry(run.getJob(), tx, events);
        } else {
            record.setStatus(JobStatus.SUCCEEDED);
        }

        if (record.getStatus() == JobStatus.SUCCEEDED && isDeleteRecordsOnSuccess()) {
            store.deleteJob(record.getId(), tx);
        } else {
            store.saveJob(record, tx);
        }

        events.add(RunnerEvent.of(RunnerEvent.Type.FINISH_JOB, record));
        log.debug("Finished job {} as {}", record.getId(), record.getStatus());
    }

    private void enqueueForRetry(Job job, JobStoreTransaction tx, List<RunnerEvent> events)
            throws JobStoreException {
        if (job == null || job.getTryNumber() > job.getRetries()) {
            return;
        }
        JobRecord retry = job.createRecord();
        retry.setTryNumber(job.getTryNumber() + 1);
        retry.setQueueDate(Instant.now().plusMillis(getRetryTimeout()));
        store.saveJob(retry, tx);

        events.add(RunnerEvent.of(RunnerEvent.Type.RETRY_ENQUEUED, retry));
        log.debug("Enqueued retry {} of {} as job {}", retry.getTryNumber(), job.getJobType(), retry.getId());
    }

    private void executeScheduledJobs() throws JobStoreException, IOException {
        int count = getMaximumConcurrency() - runs.count();
        if (count <= 0) {
            return;
        }

        Instant now = Instant.now();
        long window = lastScheduleCheck == null
                ? getHeartbeat()
                : ceilMillis(Duration.between(lastScheduleCheck, now));
        lastScheduleCheck = now;

        List<ScheduledJobTuple> tuples = getScheduledJobs();
        if (tuples.isEmpty() || window <= 0) {
            return;
        }
        List<String> names = getSchedules().stream().map(Schedule::getName).collect(Collectors.toList());

        List<RunnerEvent> events = new ArrayList<>();
        List<JobRun> added = new ArrayList<>();
        JobStoreTransaction tx = store.beginTransaction();
        try {
            List<JobRecord> latest = store.getLatestScheduledJobs(names, tx);
            for (ScheduledJobTuple tuple : ScheduleEvaluator.getExecutableTuples(tuples, latest, now, window, count)) {
                if (isScheduledJobRunning(tuple)) {
                    continue;
                }

                JobRecord record = tuple.createRecord(now);
                Job job = null;
                JobLoadException loadError = null;
                try {
                    job = registry.create(tuple.getDefinition());
                    record.setName(job.getName());
                    record.setData(job.serialize());
                } catch (JobLoadException e) {
                    loadError = e;
                    record.setStatus(JobStatus.FAILED_TO_LOAD_TYPE);
                    record.setFinishDate(now);
                    record.setException(ErrorDetails.describe(e));
                }

                store.saveJob(record, tx);
                if (job != null) {
                    JobRun run = new JobRun(record.getId(), job, tuple.getSchedule().getName());
                    run.setFinishedListener(this::onRunFinished);
                    runs.add(run);
                    added.add(run);
                } else {
                    events.add(RunnerEvent.error(record, loadError));
                }

                events.add(RunnerEvent.of(RunnerEvent.Type.EXECUTE_SCHEDULED_JOB, record));
                log.debug("Executing scheduled job {} of schedule '{}' due {}",
                        record.getJobType(), tuple.getSchedule().getName(), tuple.getExecuteOn());
            }

            if (!added.isEmpty()) {
                runs.flush();
            }
            tx.commit();
        } catch (JobStoreException | IOException | RuntimeException e) {
            rollback(tx, e);
            undoAdditions(added, e);
            throw e;
        }

        queueEvents(events);
        startRuns(added);
    }

    /**
     * Starts runs whose records have been committed and flushes the ledger again so the
     * recovery file carries their start dates.
     */
    private void startRuns(List<JobRun> added) throws IOException {
        if (added.isEmpty()) {
            return;
        }
        added.forEach(JobRun::start);
        runs.flush();
    }

    private boolean isScheduledJobRunning(ScheduledJobTuple tuple) {
        String scheduleName = tuple.getSchedule().getName();
        String jobType = tuple.getDefinition().getJobType();
        return runs.getAll().stream()
                .anyMatch(run -> scheduleName.equalsIgnoreCase(run.getScheduleName())
                        && jobType.equals(run.getJobType()));
    }

    private void dequeueJobs() throws JobStoreException, IOException {
        int count = getMaximumConcurrency() - runs.count();
        if (count <= 0) {
            return;
        }

        Instant now = Instant.now();
        List<RunnerEvent> events = new ArrayList<>();
        List<JobRun> added = new ArrayList<>();
        JobStoreTransaction tx = store.beginTransaction();
        try {
            for (JobRecord record : store.getJobs(JobStatus.QUEUED, count, now, tx)) {
                record.setStatus(JobStatus.STARTED);
                record.setStartDate(now);

                Job job = null;
                JobLoadException loadError = null;
                try {
                    job = registry.toJob(record);
                } catch (JobLoadException e) {
                    loadError = e;
                    record.setStatus(JobStatus.FAILED_TO_LOAD_TYPE);
                    record.setFinishDate(now);
                    record.setException(ErrorDetails.describe(e));
                }

                store.saveJob(record, tx);
                if (job != null) {
                    JobRun run = new JobRun(record.getId(), job, record.getScheduleName());
                    run.setFinishedListener(this::onRunFinished);
                    runs.add(run);
                    added.add(run);
                } else {
                    log.warn("Could not load job {} of type {}", record.getId(), record.getJobType());
                    events.add(RunnerEvent.error(record, loadError));
                }

                events.add(RunnerEvent.of(RunnerEvent.Type.DEQUEUE_JOB, record));
                log.debug("Dequeued job {} ({})", record.getId(), record.getJobType());
            }

            if (!added.isEmpty()) {
                runs.flush();
            }
            tx.commit();
        } catch (JobStoreException | IOException | RuntimeException e) {
            rollback(tx, e);
            undoAdditions(added, e);
            throw e;
        }

        queueEvents(events);
        startRuns(added);
    }

    /**
     * Reconciles a run as soon as it finishes instead of waiting for the next heartbeat.
     */
    private void onRunFinished(JobRun run) {
        try {
            synchronized (runLock) {
                if (runs.get(run.getJobId()) != run) {
                    return;
                }
                finishRuns(List.of(run));
            }
        } catch (Exception e) {
            log.warn("Failed to reconcile finished job {}, retrying on the next heartbeat", run.getJobId(), e);
            queueEvent(RunnerEvent.error(null, e));
        }
        publishPending();
    }

    /**
     * Aborts every run and records the interruption. Called with the run lock held.
     */
    private void abortAndInterrupt() {
        List<JobRun> all = runs.getAll();
        List<JobRun> aborted = new ArrayList<>();
        List<JobRun> finished = new ArrayList<>();
        for (JobRun run : all) {
            if (run.abort()) {
                aborted.add(run);
            } else if (!run.isAborted()) {
                finished.add(run);
            }
        }

        try {
            finishRuns(finished);

            if (!aborted.isEmpty()) {
                List<RunnerEvent> events = new ArrayList<>();
                JobStoreTransaction tx = store.beginTransaction();
                try {
                    Map<Long, JobRecord> records = recordsFor(aborted, tx);
                    for (JobRun run : aborted) {
                        JobRecord record = records.get(run.getJobId());
                        if (record != null && record.getStatus().isInFlight()) {
                            record.setStatus(JobStatus.INTERRUPTED);
                            record.setFinishDate(run.getFinishDate());
                            store.saveJob(record, tx);
                            events.add(RunnerEvent.of(RunnerEvent.Type.FINISH_JOB, record));
                        }
                    }
                    tx.commit();
                } catch (JobStoreException | RuntimeException e) {
                    rollback(tx, e);
                    throw e;
                }
                queueEvents(events);
            }
            runs.clear();
        } catch (JobStoreException | IOException | RuntimeException e) {
            log.error("Failed to record interrupted jobs, they will be recovered on the next start", e);
            queueEvent(RunnerEvent.error(null, e));
        } finally {
            try {
                runs.flush();
            } catch (IOException e) {
                log.error("Failed to flush running jobs to {}", runs.getPersistencePath(), e);
                queueEvent(RunnerEvent.error(null, e));
            }
        }
    }

    private Map<Long, JobRecord> recordsFor(List<JobRun> list, JobStoreTransaction tx) throws JobStoreException {
        List<Long> ids = list.stream().map(JobRun::getJobId).collect(Collectors.toList());
        Map<Long, JobRecord> records = new HashMap<>();
        for (JobRecord record : store.getJobs(ids, tx)) {
            records.put(record.getId(), record);
        }
        return records;
    }

    private void removeAndFlush(List<Long> removals) throws IOException {
        if (removals.isEmpty()) {
            return;
        }
        for (Long id : removals) {
            runs.remove(id);
        }
        runs.flush();
    }

    private void undoAdditions(List<JobRun> added, Exception failure) {
        if (added.isEmpty()) {
            return;
        }
        for (JobRun run : added) {
            runs.remove(run.getJobId());
        }
        try {
            runs.flush();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void rollback(JobStoreTransaction tx, Exception failure) {
        if (tx.isCompleted()) {
            return;
        }
        try {
            tx.rollback();
        } catch (JobStoreException e) {
            failure.addSuppressed(e);
        }
    }

    private void queueEvent(RunnerEvent event) {
        synchronized (pendingEvents) {
            pendingEvents.add(event);
        }
    }

    private void queueEvents(List<RunnerEvent> events) {
        synchronized (pendingEvents) {
            pendingEvents.addAll(events);
        }
    }

    private void publishPending() {
        List<RunnerEvent> events;
        synchronized (pendingEvents) {
            if (pendingEvents.isEmpty()) {
                return;
            }
            events = new ArrayList<>(pendingEvents);
            pendingEvents.clear();
        }

        for (RunnerEvent event : events) {
            for (RunnerEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Runner event listener failed on {}", event.getType(), e);
                }
            }
        }
    }

    private static long ceilMillis(Duration duration) {
        long millis = duration.toMillis();
        return duration.minusMillis(millis).isZero() ? millis : millis + 1;
    }
}
