package com.umitunal.qrunner.worker;

import com.umitunal.qrunner.core.JobRegistry;
import com.umitunal.qrunner.serialization.JsonCodec;
import com.umitunal.qrunner.serialization.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ledger of the job runs a runner has started but not yet reconciled, mirrored to a
 * recovery file.
 *
 * On construction the recovery file is loaded; every entry it contains belongs to a
 * previous process and comes back finished and marked as recovered. The ledger assumes
 * it is the only writer of its file.
 */
public class RunningJobs {
    private static final Logger log = LoggerFactory.getLogger(RunningJobs.class);

    private final Path persistencePath;
    private final PayloadCodec<PersistedJobRun[]> codec;
    private final List<JobRun> runs = new ArrayList<>();

    public RunningJobs(Path persistencePath, JobRegistry registry) {
        this(persistencePath, registry, new JsonCodec<>(PersistedJobRun[].class));
    }

    public RunningJobs(Path persistencePath, JobRegistry registry, PayloadCodec<PersistedJobRun[]> codec) {
        this.persistencePath = Objects.requireNonNull(persistencePath, "persistencePath").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.runs.addAll(load(Objects.requireNonNull(registry, "registry")));
    }

    public Path getPersistencePath() {
        return persistencePath;
    }

    /**
     * Adds a run, replacing any run already tracked for the same job id.
     */
    public void add(JobRun run) {
        Objects.requireNonNull(run, "run");
        synchronized (runs) {
            runs.removeIf(r -> r.getJobId() == run.getJobId());
            runs.add(run);
        }
    }

    /**
     * @return the removed run, or null if no run was tracked for the id
     */
    public JobRun remove(long jobId) {
        synchronized (runs) {
            for (int i = 0; i < runs.size(); i++) {
                if (runs.get(i).getJobId() == jobId) {
                    return runs.remove(i);
                }
            }
            return null;
        }
    }

    public JobRun get(long jobId) {
        synchronized (runs) {
            for (JobRun run : runs) {
                if (run.getJobId() == jobId) {
                    return run;
                }
            }
            return null;
        }
    }

    public List<JobRun> getAll() {
        synchronized (runs) {
            return new ArrayList<>(runs);
        }
    }

    public List<JobRun> getRunning() {
        synchronized (runs) {
            return runs.stream().filter(JobRun::isRunning).collect(Collectors.toList());
        }
    }

    /**
     * Runs that have finished, or were aborted, but are still waiting to be reconciled.
     */
    public List<JobRun> getNotRunning() {
        synchronized (runs) {
            return runs.stream().filter(r -> !r.isRunning()).collect(Collectors.toList());
        }
    }

    public int count() {
        synchronized (runs) {
            return runs.size();
        }
    }

    public void abortAll() {
        synchronized (runs) {
            for (JobRun run : runs) {
                run.abort();
            }
        }
    }

    public void clear() {
        synchronized (runs) {
            runs.clear();
        }
    }

    /**
     * Writes the current ledger to the recovery file, replacing it atomically.
     */
    public void flush() throws IOException {
        synchronized (runs) {
            PersistedJobRun[] snapshot = runs.stream()
                    .map(JobRun::toPersisted)
                    .toArray(PersistedJobRun[]::new);
            byte[] bytes = codec.encode(snapshot);

            Path parent = persistencePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = persistencePath.resolveSibling(persistencePath.getFileName() + ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, persistencePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, persistencePath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Flushed {} running jobs to {}", snapshot.length, persistencePath);
        }
    }

    /**
     * Removes the recovery file.
     */
    public void delete() throws IOException {
        synchronized (runs) {
            Files.deleteIfExists(persistencePath);
        }
    }

    private List<JobRun> load(JobRegistry registry) {
        List<JobRun> loaded = new ArrayList<>();
        if (!Files.isRegularFile(persistencePath)) {
            return loaded;
        }

        PersistedJobRun[] entries;
        try {
            byte[] bytes = Files.readAllBytes(persistencePath);
            if (bytes.length == 0) {
                return loaded;
            }
            entries = codec.decode(bytes);
        } catch (IOException | IllegalStateException e) {
            log.warn("Could not read running jobs from {}, starting with an empty ledger", persistencePath, e);
            return loaded;
        }

        Instant now = Instant.now();
        for (PersistedJobRun entry : entries == null ? new PersistedJobRun[0] : entries) {
            if (entry == null || entry.getJobId() < 1) {
                log.warn("Skipping invalid entry in {}", persistencePath);
                continue;
            }
            loaded.add(JobRun.recover(entry, registry, now));
        }

        if (!loaded.isEmpty()) {
            log.info("Recovered {} running jobs from {}", loaded.size(), persistencePath);
        }
        return loaded;
    }
}
