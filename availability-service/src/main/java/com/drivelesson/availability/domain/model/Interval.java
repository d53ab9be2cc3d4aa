package com.drivelesson.availability.domain.model;

import com.drivelesson.common.exception.InvalidTimeRangeException;

import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}. Two intervals overlap iff
 * {@code a.start < b.end && b.start < a.end}, so touching intervals do not.
 */
public record Interval<T extends Comparable<? super T>>(T start, T end) {

    public Interval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.compareTo(start) <= 0) {
            throw new InvalidTimeRangeException(start, end);
        }
    }

    public static <T extends Comparable<? super T>> Interval<T> of(T start, T end) {
        return new Interval<>(start, end);
    }

    public boolean overlaps(Interval<T> other) {
        return overlaps(start, end, other.start, other.end);
    }

    public boolean contains(T from, T to) {
        return start.compareTo(from) <= 0 && to.compareTo(end) <= 0;
    }

    public static <T extends Comparable<? super T>> boolean overlaps(T aStart, T aEnd, T bStart, T bEnd) {
        return aStart.compareTo(bEnd) < 0 && bStart.compareTo(aEnd) < 0;
    }
}
