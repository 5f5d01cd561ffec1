package com.hotelintel.sampler.model;

import java.util.function.Function;

/**
 * Explicit result of an extraction or filtering step, so skip and drop paths are
 * visible in the return type instead of being thrown and caught.
 */
public final class Outcome<T> {

    public enum Kind { ACCEPTED, SKIPPED, FAILED }

    private final Kind kind;
    private final T value;
    private final String reason;

    private Outcome(Kind kind, T value, String reason) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
    }

    public static <T> Outcome<T> accepted(T value) {
        return new Outcome<>(Kind.ACCEPTED, value, null);
    }

    public static <T> Outcome<T> skipped(String reason) {
        return new Outcome<>(Kind.SKIPPED, null, reason);
    }

    public static <T> Outcome<T> failed(String reason) {
        return new Outcome<>(Kind.FAILED, null, reason);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }

    /** The accepted value; throws for skipped or failed outcomes. */
    public T value() {
        if (kind != Kind.ACCEPTED) {
            throw new IllegalStateException("No value for " + kind + " outcome: " + reason);
        }
        return value;
    }

    public String reason() {
        return reason;
    }

    public <R> Outcome<R> map(Function<T, R> fn) {
        return kind == Kind.ACCEPTED ? accepted(fn.apply(value)) : new Outcome<>(kind, null, reason);
    }

    @Override
    public String toString() {
        return kind == Kind.ACCEPTED ? "Accepted(" + value + ")" : kind + "(" + reason + ")";
    }
}
