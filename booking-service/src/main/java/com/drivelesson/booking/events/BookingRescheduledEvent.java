package com.drivelesson.booking.events;

import com.drivelesson.booking.domain.model.BookingActor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRescheduledEvent implements BookingEvent {
    private Long previousBookingId;
    private Long bookingId;
    private String reference;
    private Long studentId;
    private Long providerId;
    private Instant previousLessonStart;
    private Instant lessonStart;
    private int rebookingCount;
    private BookingActor actor;
    private BigDecimal creditApplied;
    private BigDecimal balanceDue;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return String.valueOf(previousBookingId);
    }
}
