package com.faultline.core.pattern;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A tight cluster of occurrences.
 *
 * @since 1.0.0
 */
public final class Burst {

    private final Instant start;
    private final Instant end;
    private final int count;

    public Burst(Instant start, Instant end, int count) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.count = count;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public int getCount() {
        return count;
    }

    /** Duration in seconds, rounded to one decimal. */
    public double getDurationSeconds() {
        double seconds = Duration.between(start, end).toMillis() / 1000.0;
        return Math.round(seconds * 10) / 10.0;
    }

    public BurstIntensity getIntensity() {
        return BurstIntensity.fromCount(count);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Burst that))
            return false;
        return count == that.count && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, count);
    }

    @Override
    public String toString() {
        return "Burst{start=" + start + ", end=" + end + ", count=" + count
                + ", intensity=" + getIntensity() + '}';
    }
}
