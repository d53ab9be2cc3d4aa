package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.domain.model.BookedLesson;
import com.drivelesson.availability.domain.model.LessonSlot;
import com.drivelesson.availability.domain.model.SlotMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks slots against existing bookings. Only active bookings (see
 * {@link com.drivelesson.common.model.BookingStatus#isActive()}) block a slot.
 */
@Component
public class ConflictResolver {

    public List<LessonSlot> resolve(Iterable<LessonSlot> slots, List<BookedLesson> bookings, SlotMode mode) {
        List<BookedLesson> active = bookings.stream().filter(BookedLesson::isActive).toList();
        List<LessonSlot> result = new ArrayList<>();
        for (LessonSlot slot : slots) {
            boolean booked = clashes(slot.start().toInstant(), slot.end().toInstant(), active, null);
            if (!booked) {
                result.add(slot);
            } else if (mode == SlotMode.SHOW_BOOKED) {
                result.add(slot.markBooked());
            }
        }
        return result;
    }

    /**
     * True when {@code [start, end)} overlaps an active booking other than {@code excludeBookingId}.
     */
    public boolean clashes(Instant start, Instant end, List<BookedLesson> bookings, Long excludeBookingId) {
        for (BookedLesson booking : bookings) {
            if (!booking.isActive() || (excludeBookingId != null && Objects.equals(excludeBookingId, booking.bookingId()))) {
                continue;
            }
            if (booking.overlaps(start, end)) {
                return true;
            }
        }
        return false;
    }
}
