package com.spendguard.core.store;

import com.spendguard.core.SpendGuardException;

/**
 * A persistent store could not be reached or did not answer in time.
 * Callers on the enforcement path treat this as "unknown" and fail open;
 * callers on the recording path retry.
 */
public class StoreException extends SpendGuardException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
