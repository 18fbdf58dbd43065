package com.spendguard.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void recordingFailed(ResponseReceived event, Throwable cause) {
        log.error("[SpendGuard] Cost for request {} could not be recorded, usage {}: {}",
                event.getRequestId(), event.getUsage(), cause.getMessage(), cause);
    }

    @Override
    public void taskRejected(ResponseReceived event, Throwable cause) {
        log.error("[SpendGuard] Cost recording for request {} was rejected by the executor, usage {}",
                event.getRequestId(), event.getUsage(), cause);
    }
}
