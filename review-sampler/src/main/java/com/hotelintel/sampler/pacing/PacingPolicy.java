package com.hotelintel.sampler.pacing;

import com.hotelintel.sampler.config.SamplerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Human-like pacing: randomized think-times between operations and the pointer path
 * used to drag slider challenges.
 *
 * Motion synthesis has no browser dependency; the driver only replays the steps.
 */
@Component
@Slf4j
public class PacingPolicy {

    static final int MIN_STEP = 20;
    static final int MAX_STEP = 50;
    static final int MAX_JITTER = 2;
    static final long MIN_STEP_MILLIS = 50;
    static final long MAX_STEP_MILLIS = 150;
    static final double HESITATION_CHANCE = 0.3;
    static final long MAX_HESITATION_MILLIS = 100;

    private final SamplerProperties.Pacing pacing;
    private final Random random;

    @Autowired
    public PacingPolicy(SamplerProperties properties) {
        this(properties, new Random());
    }

    PacingPolicy(SamplerProperties properties, Random random) {
        this.pacing = properties.getPacing();
        this.random = random;
    }

    /**
     * @return a delay drawn uniformly from the configured range for {@code kind}
     */
    public Duration nextDelay(DelayKind kind) {
        SamplerProperties.Range range = rangeFor(kind);
        long min = range.getMin().toMillis();
        long max = range.getMax().toMillis();
        if (max <= min) return Duration.ofMillis(Math.max(0, min));
        return Duration.ofMillis(min + (long) (random.nextDouble() * (max - min)));
    }

    /** Blocks for {@link #nextDelay(DelayKind)}. Interruption ends the wait early. */
    public void pause(DelayKind kind) {
        Duration delay = nextDelay(kind);
        if (delay.isZero()) return;
        log.debug("Pausing {} ms ({})", delay.toMillis(), kind);
        sleepMs(delay.toMillis());
    }

    public List<MotionStep> synthesizeMotion(int trackLength) {
        return synthesizeMotion(trackLength, random.nextLong());
    }

    /**
     * Variable-step drag path along a slider track.
     *
     * Every step advances by 20-50 px (the last one is clipped), drifts by at most 2 px
     * laterally, and takes 50-150 ms plus, three times in ten, a short hesitation.
     * The cumulative dx equals {@code trackLength} exactly.
     */
    public static List<MotionStep> synthesizeMotion(int trackLength, long seed) {
        Random rnd = new Random(seed);
        List<MotionStep> steps = new ArrayList<>();
        int x = 0;
        while (x < trackLength) {
            int step = MIN_STEP + rnd.nextInt(MAX_STEP - MIN_STEP + 1);
            if (x + step > trackLength) {
                step = trackLength - x;
            }
            int dy = rnd.nextInt(2 * MAX_JITTER + 1) - MAX_JITTER;
            long dt = MIN_STEP_MILLIS + (long) (rnd.nextDouble() * (MAX_STEP_MILLIS - MIN_STEP_MILLIS));
            if (rnd.nextDouble() < HESITATION_CHANCE) {
                dt += MAX_HESITATION_MILLIS / 2 + (long) (rnd.nextDouble() * (MAX_HESITATION_MILLIS / 2));
            }
            steps.add(new MotionStep(step, dy, dt));
            x += step;
        }
        return steps;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private SamplerProperties.Range rangeFor(DelayKind kind) {
        return switch (kind) {
            case INTER_REQUEST -> pacing.getInterRequest();
            case INTER_ZONE -> pacing.getInterZone();
            case INTER_REGION -> pacing.getInterRegion();
        };
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
