package com.hotelintel.sampler.exception;

/**
 * Navigation failure, timeout or anti-automation block. Retried through the
 * task state machine; never fatal to a run.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
