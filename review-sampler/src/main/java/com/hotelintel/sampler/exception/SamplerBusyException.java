package com.hotelintel.sampler.exception;

/**
 * Thrown when an acquisition entry point is called while another one holds the
 * browser session.
 */
public class SamplerBusyException extends RuntimeException {

    public SamplerBusyException(String message) {
        super(message);
    }
}
