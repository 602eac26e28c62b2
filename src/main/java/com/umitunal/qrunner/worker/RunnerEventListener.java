package com.umitunal.qrunner.worker;

/**
 * Receives runner notifications. Called on the runner's threads; implementations
 * should return quickly.
 */
@FunctionalInterface
public interface RunnerEventListener {
    void onEvent(RunnerEvent event);
}
