package com.drivelesson.availability.domain.model;

/**
 * Scheduling view of an instructor. A provider that is not accepting bookings
 * simply has no slots.
 */
public record ProviderProfile(Long providerId, String displayName, boolean acceptingBookings) {
}
