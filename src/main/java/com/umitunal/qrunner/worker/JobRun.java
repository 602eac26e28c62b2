package com.umitunal.qrunner.worker;

import com.umitunal.qrunner.core.CancellationToken;
import com.umitunal.qrunner.core.Job;
import com.umitunal.qrunner.core.JobLoadException;
import com.umitunal.qrunner.core.JobRegistry;
import com.umitunal.qrunner.serialization.ErrorDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Executes one job on its own thread and tracks timing and outcome.
 *
 * A run is started at most once. It either finishes naturally, in which case the
 * finished listener is notified, or it is aborted, in which case it is not. Abort and
 * natural completion are serialized on a run-local lock so exactly one of them wins.
 */
public class JobRun {
    private static final Logger log = LoggerFactory.getLogger(JobRun.class);

    private final Object runLock = new Object();
    private final long jobId;
    private final Job job;
    private final String scheduleName;
    private final CancellationToken token = new CancellationToken();

    private final String jobType;
    private final String jobData;

    private volatile boolean running;
    private volatile boolean aborted;
    private volatile boolean wasRecovered;
    private volatile Instant startDate;
    private volatile Instant finishDate;
    private volatile Throwable executionException;
    private volatile String recoveredError;
    private volatile Consumer<JobRun> finishedListener;
    private Thread thread;

    public JobRun(long jobId, Job job) {
        this(jobId, job, null);
    }

    public JobRun(long jobId, Job job, String scheduleName) {
        this(jobId, job, scheduleName, null, null);
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null.");
        }
    }

    private JobRun(long jobId, Job job, String scheduleName, String jobType, String jobData) {
        if (jobId < 1) {
            throw new IllegalArgumentException("jobId must be greater than 0.");
        }
        this.jobId = jobId;
        this.job = job;
        this.scheduleName = scheduleName;
        this.jobType = jobType;
        this.jobData = jobData;
    }

    /**
     * Rebuilds a run from the recovery file. The result is finished and marked as
     * recovered; if the job cannot be rebuilt, the load failure becomes its execution error.
     */
    static JobRun recover(PersistedJobRun persisted, JobRegistry registry, Instant now) {
        Job job = null;
        JobLoadException loadError = null;

        if (persisted.getJobType() != null && persisted.getJobData() != null) {
            try {
                job = registry.deserialize(persisted.getJobType(), persisted.getJobData());
                job.setTryNumber(Math.max(1, persisted.getTryNumber()));
            } catch (JobLoadException e) {
                loadError = e;
            }
        }

        JobRun run = new JobRun(persisted.getJobId(), job, persisted.getScheduleName(),
                persisted.getJobType(), persisted.getJobData());
        run.wasRecovered = true;
        run.startDate = persisted.getStartDate() == null ? null : Instant.ofEpochMilli(persisted.getStartDate());
        run.finishDate = persisted.getFinishDate() == null ? now : Instant.ofEpochMilli(persisted.getFinishDate());
        run.recoveredError = persisted.getExecutionError();
        if (run.recoveredError == null && loadError != null) {
            run.executionException = loadError;
        }
        return run;
    }

    /**
     * Starts the job on a new daemon thread. Does nothing if the run is already running,
     * has already finished, or has no job.
     */
    public void start() {
        synchronized (runLock) {
            if (running || finishDate != null || job == null) {
                return;
            }
            running = true;
            startDate = Instant.now();
            thread = new Thread(this::execute, "job-run-" + jobId);
            thread.setDaemon(true);
            thread.start();
        }
        log.debug("Started run of job {} ({})", jobId, job.getJobType());
    }

    /**
     * Stops the run if it is still running. The job's token is signalled and its thread
     * interrupted; work the job already did is not undone.
     *
     * @return true if the run was aborted, false if it was not running
     */
    public boolean abort() {
        synchronized (runLock) {
            if (!running) {
                return false;
            }
            aborted = true;
            running = false;
            finishDate = Instant.now();
            token.requestStop("Job run " + jobId + " aborted");
            try {
                thread.interrupt();
            } catch (SecurityException e) {
                log.warn("Could not interrupt the thread of job {}", jobId, e);
            }
        }
        log.debug("Aborted run of job {}", jobId);
        return true;
    }

    private void execute() {
        Throwable error = null;
        try {
            job.execute(token);
        } catch (Throwable t) {
            error = t;
        }

        Consumer<JobRun> listener;
        synchronized (runLock) {
            if (aborted) {
                return;
            }
            executionException = error;
            finishDate = Instant.now();
            running = false;
            listener = finishedListener;
        }

        log.debug("Run of job {} finished{}", jobId, error == null ? "" : " with an error");
        if (listener != null) {
            listener.accept(this);
        }
    }

    public void setFinishedListener(Consumer<JobRun> listener) {
        this.finishedListener = listener;
    }

    public long getJobId() {
        return jobId;
    }

    /**
     * The job, or null for a recovered run whose job could not be rebuilt.
     */
    public Job getJob() {
        return job;
    }

    public String getJobType() {
        return job != null ? job.getJobType() : jobType;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isAborted() {
        return aborted;
    }

    public boolean wasRecovered() {
        return wasRecovered;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getFinishDate() {
        return finishDate;
    }

    public Throwable getExecutionException() {
        return executionException;
    }

    /**
     * Text form of the execution error, including errors carried over from the recovery file.
     */
    public String getExecutionError() {
        return executionException != null ? ErrorDetails.describe(executionException) : recoveredError;
    }

    public boolean hasExecutionError() {
        return executionException != null || recoveredError != null;
    }

    /**
     * Time spent running, up to the finish date or {@code now}.
     */
    public Duration elapsed(Instant now) {
        if (startDate == null) {
            return Duration.ZERO;
        }
        Instant end = finishDate != null ? finishDate : now;
        return Duration.between(startDate, end);
    }

    PersistedJobRun toPersisted() {
        PersistedJobRun persisted = new PersistedJobRun();
        persisted.setJobId(jobId);
        persisted.setJobType(getJobType());
        persisted.setJobData(job != null ? job.serialize() : jobData);
        persisted.setScheduleName(scheduleName);
        persisted.setStartDate(startDate == null ? null : startDate.toEpochMilli());
        persisted.setFinishDate(finishDate == null ? null : finishDate.toEpochMilli());
        persisted.setExecutionError(getExecutionError());
        persisted.setTryNumber(job != null ? job.getTryNumber() : 1);
        return persisted;
    }

    @Override
    public String toString() {
        return "JobRun{jobId=" + jobId + ", type=" + getJobType() + ", running=" + running
                + ", recovered=" + wasRecovered + "}";
    }
}
