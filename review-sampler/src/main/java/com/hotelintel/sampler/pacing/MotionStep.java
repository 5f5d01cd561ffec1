package com.hotelintel.sampler.pacing;

/**
 * One relative pointer move: {@code dx} pixels along the track, {@code dy} pixels of
 * lateral jitter, taking {@code dtMillis}.
 */
public record MotionStep(int dx, int dy, long dtMillis) {
}
