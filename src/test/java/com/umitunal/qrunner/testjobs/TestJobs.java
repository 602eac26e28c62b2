package com.umitunal.qrunner.testjobs;

import com.umitunal.qrunner.core.JobRegistry;

public final class TestJobs {

    private TestJobs() {
    }

    public static JobRegistry registry() {
        return new JobRegistry()
                .register(TestQuickJob.class, TestQuickJob::new)
                .register(TestSlowJob.class, TestSlowJob::new)
                .register(TestTimeoutJob.class, TestTimeoutJob::new)
                .register(TestIdJob.class, TestIdJob::new)
                .register(TestFailJob.class, TestFailJob::new)
                .register(TestFailRetryJob.class, TestFailRetryJob::new)
                .register(TestScheduledJob.class, TestScheduledJob::new);
    }
}
