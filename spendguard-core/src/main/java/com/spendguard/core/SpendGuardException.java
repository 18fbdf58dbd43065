package com.spendguard.core;

/**
 * Base class for failures raised inside the SpendGuard pipeline.
 */
public class SpendGuardException extends RuntimeException {

    public SpendGuardException(String message) {
        super(message);
    }

    public SpendGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
