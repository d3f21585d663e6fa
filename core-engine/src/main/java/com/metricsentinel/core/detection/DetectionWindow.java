package com.metricsentinel.core.detection;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range whose points are tested by a detector. Points dated
 * before {@link #getFrom()} are history only.
 *
 * @since 1.0.0
 */
public final class DetectionWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate from;
    private final LocalDate to;

    public DetectionWindow(LocalDate from, LocalDate to) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Detection window end " + to + " is before start " + from);
        }
    }

    public static DetectionWindow of(LocalDate from, LocalDate to) {
        return new DetectionWindow(from, to);
    }

    public static DetectionWindow single(LocalDate date) {
        return new DetectionWindow(date, date);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }

    public LocalDate getFrom() {
        return from;
    }

    public LocalDate getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionWindow that))
            return false;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + "]";
    }
}
