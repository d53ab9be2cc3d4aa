package com.drivelesson.common.util;

/**
 * Scheduling defaults shared by the availability and booking modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String DEFAULT_ZONE_ID = "Africa/Johannesburg";

    public static final int BUFFER_MINUTES = 15;
    public static final int MIN_DURATION_MINUTES = 30;
    public static final int MAX_DURATION_MINUTES = 180;
    public static final int MAX_LOOKAHEAD_DAYS = 60;

    public static final String BOOKING_REFERENCE_PREFIX = "BK";
}
