package com.spendguard.core.event;

/**
 * Last-resort sink for failures that happen off the request thread and
 * could not be retried away. Nothing reported here reaches the caller.
 */
public interface ErrorReporter {

    void recordingFailed(ResponseReceived event, Throwable cause);

    void taskRejected(ResponseReceived event, Throwable cause);
}
