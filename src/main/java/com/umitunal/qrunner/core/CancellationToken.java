package com.umitunal.qrunner.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal handed to {@link Job#execute(CancellationToken)}.
 * One token per run. Long-running jobs should poll it between units of work.
 */
public final class CancellationToken {
    private final AtomicBoolean stop = new AtomicBoolean(false);
    private volatile String reason = "";

    public boolean isStopRequested() {
        return stop.get();
    }

    public String reason() {
        return reason;
    }

    /**
     * Signals the job to stop. Only the first request records its reason.
     */
    public void requestStop(String reason) {
        if (stop.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    /**
     * Throws InterruptedException if a stop has been requested.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) {
            throw new InterruptedException("Stop requested: " + reason);
        }
    }
}
