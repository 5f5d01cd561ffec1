package com.hotelintel.sampler.model;

public enum TaskKind {
    LIST_FETCH,
    REVIEW_FETCH
}
