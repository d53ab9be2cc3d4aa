package com.drivelesson.booking.domain.service;

import com.drivelesson.common.util.Constants;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Human-friendly booking references such as {@code BK3F9A12C0}.
 */
@Component
public class BookingReferenceGenerator {

    public String next() {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return Constants.BOOKING_REFERENCE_PREFIX + hex.toUpperCase(Locale.ROOT);
    }
}
