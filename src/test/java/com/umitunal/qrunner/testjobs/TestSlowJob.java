package com.umitunal.qrunner.testjobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.umitunal.qrunner.core.CancellationToken;
import com.umitunal.qrunner.core.Job;
import com.umitunal.qrunner.core.JobType;

@JobType("test-slow")
public class TestSlowJob extends Job {
    private long durationMillis = 3000;

    @JsonIgnore
    private volatile boolean executing;

    public TestSlowJob() {
    }

    public TestSlowJob(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    @Override
    public String getName() {
        return "Slow Job";
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /**
     * True while {@link #execute} is on the stack.
     */
    public boolean isExecuting() {
        return executing;
    }

    @Override
    public void execute(CancellationToken token) throws InterruptedException {
        executing = true;
        try {
            long deadline = System.currentTimeMillis() + durationMillis;
            while (System.currentTimeMillis() < deadline) {
                token.throwIfStopRequested();
                Thread.sleep(20);
            }
        } finally {
            executing = false;
        }
    }
}
