package com.debateplatform.engine.scheduler;

/** A batch cycle was requested while another one is still running. */
public class BatchCycleInProgressException extends RuntimeException {

    public BatchCycleInProgressException(String runningCycleId) {
        super("batch cycle " + runningCycleId + " is still running");
    }
}
