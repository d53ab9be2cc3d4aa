package com.drivelesson.availability.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable, start-ordered collection of half-open intervals.
 * <p>
 * Union does not coalesce: a provider may publish overlapping or duplicate open
 * intervals and each one stays a separate entry. Subtraction cuts every member
 * independently, splitting it in two when the removed window lies strictly inside.
 */
public final class IntervalSet<T extends Comparable<? super T>> implements Iterable<Interval<T>> {

    private final List<Interval<T>> intervals;

    private IntervalSet(List<Interval<T>> intervals) {
        List<Interval<T>> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(Interval::start));
        this.intervals = Collections.unmodifiableList(sorted);
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> empty() {
        return new IntervalSet<>(List.of());
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> of(List<Interval<T>> intervals) {
        return new IntervalSet<>(intervals);
    }

    public IntervalSet<T> union(IntervalSet<T> other) {
        List<Interval<T>> merged = new ArrayList<>(intervals);
        merged.addAll(other.intervals);
        return new IntervalSet<>(merged);
    }

    public IntervalSet<T> subtract(Interval<T> removed) {
        List<Interval<T>> result = new ArrayList<>();
        for (Interval<T> interval : intervals) {
            if (!interval.overlaps(removed)) {
                result.add(interval);
                continue;
            }
            if (interval.start().compareTo(removed.start()) < 0) {
                result.add(Interval.of(interval.start(), removed.start()));
            }
            if (removed.end().compareTo(interval.end()) < 0) {
                result.add(Interval.of(removed.end(), interval.end()));
            }
        }
        return new IntervalSet<>(result);
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public int size() {
        return intervals.size();
    }

    public List<Interval<T>> asList() {
        return intervals;
    }

    public Stream<Interval<T>> stream() {
        return intervals.stream();
    }

    /** True when some member fully contains {@code [from, to)}. */
    public boolean covers(T from, T to) {
        return intervals.stream().anyMatch(i -> i.contains(from, to));
    }

    @Override
    public Iterator<Interval<T>> iterator() {
        return intervals.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalSet<?> other)) return false;
        return intervals.equals(other.intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        return "IntervalSet" + intervals;
    }
}
