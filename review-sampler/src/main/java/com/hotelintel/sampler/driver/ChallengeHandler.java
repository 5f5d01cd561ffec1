package com.hotelintel.sampler.driver;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.exception.ChallengeUnresolvedException;
import com.hotelintel.sampler.pacing.MotionStep;
import com.hotelintel.sampler.pacing.PacingPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalInt;

/**
 * Clears anti-automation challenges: one automatic slider drag, then a bounded wait
 * for an operator. A challenge that survives both becomes a transient fetch failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChallengeHandler {

    private final PacingPolicy pacingPolicy;
    private final ManualInterventionGate gate;
    private final SamplerProperties properties;

    /**
     * Returns normally when no challenge is (or remains) on screen.
     *
     * @throws ChallengeUnresolvedException when the challenge is still present after the
     *                                      operator resumed or the wait timed out
     */
    public void ensureClear(PageDriver driver) {
        if (!driver.challengePresent()) return;

        log.warn("Challenge detected, attempting automatic slide");
        if (trySlide(driver)) {
            log.info("Automatic slide accepted");
            return;
        }

        log.warn("==================================================");
        log.warn("Manual challenge required: solve it in the browser, then POST /challenge/resume");
        log.warn("==================================================");

        boolean resumed = gate.awaitResume(properties.getBrowser().getManualResumeTimeout());
        if (!driver.challengePresent()) {
            log.info("Challenge cleared manually");
            return;
        }
        throw new ChallengeUnresolvedException(resumed
                ? "Challenge still present after operator resume"
                : "Timed out waiting for operator to clear challenge");
    }

    private boolean trySlide(PageDriver driver) {
        OptionalInt track = driver.sliderTrackLength();
        if (track.isEmpty() || track.getAsInt() <= 0) {
            log.debug("No slider track found");
            return false;
        }
        List<MotionStep> motion = pacingPolicy.synthesizeMotion(track.getAsInt());
        return driver.dragSlider(motion) && !driver.challengePresent();
    }
}
