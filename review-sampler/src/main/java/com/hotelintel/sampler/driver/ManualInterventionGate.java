package com.hotelintel.sampler.driver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the acquisition worker until an operator signals that a challenge was
 * cleared by hand in the browser, or until the timeout passes.
 */
@Component
@Slf4j
public class ManualInterventionGate {

    private volatile CountDownLatch latch;

    /**
     * @return true when an operator resumed, false on timeout or interruption
     */
    public boolean awaitResume(Duration timeout) {
        CountDownLatch current = new CountDownLatch(1);
        latch = current;
        try {
            return current.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            latch = null;
        }
    }

    /** @return false when nothing was waiting */
    public boolean resume() {
        CountDownLatch current = latch;
        if (current == null) {
            log.info("Resume requested but no challenge is waiting");
            return false;
        }
        current.countDown();
        log.info("Operator resumed after manual challenge");
        return true;
    }

    public boolean isWaiting() {
        return latch != null;
    }
}
