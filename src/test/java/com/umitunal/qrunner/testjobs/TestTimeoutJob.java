package com.umitunal.qrunner.testjobs;

import com.umitunal.qrunner.core.CancellationToken;
import com.umitunal.qrunner.core.Job;
import com.umitunal.qrunner.core.JobType;

@JobType("test-timeout")
public class TestTimeoutJob extends Job {
    private int retries;

    public TestTimeoutJob() {
    }

    public TestTimeoutJob(int retries) {
        this.retries = retries;
    }

    @Override
    public String getName() {
        return "Timeout Job";
    }

    @Override
    public int getRetries() {
        return retries;
    }

    @Override
    public long getTimeout() {
        return 100;
    }

    @Override
    public void execute(CancellationToken token) throws InterruptedException {
        while (!token.isStopRequested()) {
            Thread.sleep(20);
        }
    }
}
