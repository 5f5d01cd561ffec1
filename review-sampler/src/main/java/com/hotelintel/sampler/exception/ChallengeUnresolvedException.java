package com.hotelintel.sampler.exception;

/**
 * The slider challenge was still on screen after the automatic attempt and the
 * manual-intervention wait.
 */
public class ChallengeUnresolvedException extends TransientFetchException {

    public ChallengeUnresolvedException(String message) {
        super(message);
    }
}
