package com.catdb.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a unit of work run under a deadline: a value, a timeout, or a failure.
 *
 * @param <T> value type
 */
public final class DeadlineOutcome<T> {

    /**
     * How the work ended.
     */
    public enum Status {
        COMPLETED,
        TIMED_OUT,
        FAILED
    }

    private final Status status;
    private final T value;
    private final Throwable error;
    private final Duration deadline;

    private DeadlineOutcome(Status status, T value, Throwable error, Duration deadline) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.deadline = deadline;
    }

    static <T> DeadlineOutcome<T> completed(T value, Duration deadline) {
        return new DeadlineOutcome<>(Status.COMPLETED, value, null, deadline);
    }

    static <T> DeadlineOutcome<T> timedOut(Duration deadline) {
        return new DeadlineOutcome<>(Status.TIMED_OUT, null, null, deadline);
    }

    static <T> DeadlineOutcome<T> failed(Throwable error, Duration deadline) {
        return new DeadlineOutcome<>(Status.FAILED, null, error, deadline);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }

    /**
     * Get the value, or null unless completed.
     *
     * @return value
     */
    public T getValue() {
        return value;
    }

    /**
     * Get the failure cause, or null unless failed.
     *
     * @return error
     */
    public Throwable getError() {
        return error;
    }

    /**
     * Value when completed, otherwise the fallback.
     *
     * @param fallback fallback
     * @return value or fallback
     */
    public T orElse(T fallback) {
        return isCompleted() ? value : fallback;
    }

    /**
     * Short text for soft failure markers and logs.
     *
     * @return description
     */
    public String describe() {
        switch (status) {
            case COMPLETED:
                return "completed";
            case TIMED_OUT:
                return "timed out after " + deadline.toMillis() + " ms";
            default:
                return "failed: " + (error != null ? Objects.toString(error.getMessage(), error.getClass().getSimpleName()) : "unknown");
        }
    }
}
