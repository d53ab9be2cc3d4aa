package com.drivelesson.booking.events;

import com.drivelesson.common.model.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published when a lesson starts, completes or is marked as a no-show.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonStatusChangedEvent implements BookingEvent {
    private Long bookingId;
    private Long studentId;
    private Long providerId;
    private BookingStatus previousStatus;
    private BookingStatus status;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return String.valueOf(bookingId);
    }
}
