package com.hotelintel.sampler.pacing;

/** Operation classes with increasingly wide think-time ranges. */
public enum DelayKind {
    INTER_REQUEST,
    INTER_ZONE,
    INTER_REGION
}
