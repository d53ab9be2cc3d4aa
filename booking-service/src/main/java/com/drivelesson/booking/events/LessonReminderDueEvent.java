package com.drivelesson.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published by the reminder job for a lesson starting soon. The messaging side
 * decides the channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonReminderDueEvent implements BookingEvent {

    public enum Recipient {
        STUDENT,
        PROVIDER
    }

    private Long bookingId;
    private String reference;
    private Recipient recipient;
    private Long recipientId;
    private Instant lessonStart;
    private long minutesUntilStart;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return String.valueOf(bookingId);
    }
}
