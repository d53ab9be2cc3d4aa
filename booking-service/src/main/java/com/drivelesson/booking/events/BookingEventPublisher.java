package com.drivelesson.booking.events;

import java.util.List;

/**
 * Outbound port for booking events.
 */
public interface BookingEventPublisher {

    void publish(BookingEvent event);

    default void publishAll(List<? extends BookingEvent> events) {
        events.forEach(this::publish);
    }
}
