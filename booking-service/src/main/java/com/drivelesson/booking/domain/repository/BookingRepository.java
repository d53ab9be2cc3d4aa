package com.drivelesson.booking.domain.repository;

import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.common.model.BookingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Booking storage, provided by the persistence layer.
 */
public interface BookingRepository {

    /** Stores a new booking and returns it with its generated id. */
    LessonBooking createBooking(LessonBooking booking);

    /** Persists status, payment, cancellation and reminder changes of an existing booking. */
    LessonBooking updateBooking(LessonBooking booking);

    Optional<LessonBooking> findById(Long id);

    List<LessonBooking> findByStudentId(Long studentId);

    List<LessonBooking> findByProviderId(Long providerId);

    /** PENDING and CONFIRMED bookings whose lesson starts in {@code [from, to)}. */
    List<LessonBooking> findActiveStartingBetween(Instant from, Instant to);

    /** Same as {@link #findActiveStartingBetween} restricted to one provider. */
    List<LessonBooking> findActiveByProviderStartingBetween(Long providerId, Instant from, Instant to);

    /** Bookings in one of {@code statuses} whose lesson starts in {@code [from, to)}. */
    List<LessonBooking> findByStatusStartingBetween(Set<BookingStatus> statuses, Instant from, Instant to);
}
