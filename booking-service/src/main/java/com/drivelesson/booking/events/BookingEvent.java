package com.drivelesson.booking.events;

/**
 * Domain event emitted by the booking core.
 */
public interface BookingEvent {

    /** Key used to keep events of one booking (or provider) in order. */
    String partitionKey();
}
