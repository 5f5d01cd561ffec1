package com.hotelintel.sampler.model;

/**
 * Score filter offered by the source's review tab. {@code code} is the value
 * the site uses in its {@code rateScore} parameter.
 */
public enum ReviewFilter {
    ALL(0),
    GOOD(1),
    MEDIUM(2),
    BAD(3);

    private final int code;

    ReviewFilter(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
