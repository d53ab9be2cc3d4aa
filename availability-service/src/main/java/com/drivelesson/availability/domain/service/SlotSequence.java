package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.domain.model.Interval;
import com.drivelesson.availability.domain.model.IntervalSet;
import com.drivelesson.availability.domain.model.LessonSlot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite slot sequence for one date. Every call to {@link #iterator()}
 * starts over from the first interval and yields the same slots.
 * <p>
 * Within an interval slots start at the interval start and step by
 * {@code duration + buffer}; a slot never runs past the interval end. A candidate
 * that overlaps a slot already produced from an earlier interval is skipped.
 */
public final class SlotSequence implements Iterable<LessonSlot> {

    private static final long SECONDS_PER_MINUTE = 60L;

    private final LocalDate date;
    private final IntervalSet<LocalTime> intervals;
    private final int durationMinutes;
    private final int bufferMinutes;
    private final ZoneId zone;

    SlotSequence(LocalDate date, IntervalSet<LocalTime> intervals, int durationMinutes, int bufferMinutes, ZoneId zone) {
        this.date = date;
        this.intervals = intervals;
        this.durationMinutes = durationMinutes;
        this.bufferMinutes = bufferMinutes;
        this.zone = zone;
    }

    public LocalDate date() {
        return date;
    }

    public Stream<LessonSlot> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<LessonSlot> toList() {
        return stream().toList();
    }

    @Override
    public Iterator<LessonSlot> iterator() {
        return new SlotIterator();
    }

    private final class SlotIterator implements Iterator<LessonSlot> {
        private final Iterator<Interval<LocalTime>> remaining = intervals.iterator();
        private final List<long[]> produced = new ArrayList<>();
        private long cursor;
        private long intervalEnd = -1;
        private LessonSlot next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public LessonSlot next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LessonSlot slot = next;
            next = null;
            return slot;
        }

        // Seconds of day avoid LocalTime wrapping past midnight.
        private LessonSlot advance() {
            long duration = durationMinutes * SECONDS_PER_MINUTE;
            long step = (long) (durationMinutes + bufferMinutes) * SECONDS_PER_MINUTE;
            while (true) {
                if (intervalEnd < 0 || cursor + duration > intervalEnd) {
                    if (!remaining.hasNext()) {
                        return null;
                    }
                    Interval<LocalTime> interval = remaining.next();
                    cursor = interval.start().toSecondOfDay();
                    intervalEnd = interval.end().toSecondOfDay();
                    continue;
                }
                long start = cursor;
                long end = cursor + duration;
                cursor += step;
                if (clashesWithProduced(start, end)) {
                    continue;
                }
                produced.add(new long[]{start, end});
                ZonedDateTime slotStart = ZonedDateTime.of(date, LocalTime.ofSecondOfDay(start), zone);
                return new LessonSlot(date, slotStart, slotStart.plusMinutes(durationMinutes), durationMinutes, false);
            }
        }

        private boolean clashesWithProduced(long start, long end) {
            for (long[] slot : produced) {
                if (Interval.overlaps(slot[0], slot[1], start, end)) {
                    return true;
                }
            }
            return false;
        }
    }
}
