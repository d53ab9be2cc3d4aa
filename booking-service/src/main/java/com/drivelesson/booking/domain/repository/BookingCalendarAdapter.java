package com.drivelesson.booking.domain.repository;

import com.drivelesson.availability.domain.model.BookedLesson;
import com.drivelesson.availability.domain.repository.BookingCalendarRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Feeds slot computation from booking storage.
 */
@Component
@RequiredArgsConstructor
public class BookingCalendarAdapter implements BookingCalendarRepository {

    private final BookingRepository bookingRepository;

    @Override
    public List<BookedLesson> getActiveBookings(Long providerId, Instant from, Instant to) {
        return bookingRepository.findActiveByProviderStartingBetween(providerId, from, to).stream()
                .map(b -> new BookedLesson(b.getId(), b.getProviderId(), b.getLessonStart(), b.getLessonEnd(), b.getStatus()))
                .toList();
    }
}
