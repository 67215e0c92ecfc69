package com.keer.studiosync.sync.service;

/**
 * A sync run that could not fetch its input. The message is safe to show to an operator.
 */
public class SyncFailedException extends RuntimeException {
    public SyncFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
