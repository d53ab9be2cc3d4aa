package com.drivelesson.availability.domain.model;

/**
 * How slots that clash with an active booking are reported.
 */
public enum SlotMode {
    /** Booked slots are dropped. */
    AVAILABLE_ONLY,
    /** Booked slots are kept and flagged so a calendar can grey them out. */
    SHOW_BOOKED
}
