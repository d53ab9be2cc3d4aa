package com.drivelesson.availability.config;

import com.drivelesson.common.util.Constants;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Slot and booking window settings, bound from {@code lesson.scheduling.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "lesson.scheduling")
public class SchedulingProperties {

    /** All providers operate in this zone. */
    @NotBlank
    private String zoneId = Constants.DEFAULT_ZONE_ID;

    @Min(0)
    private int bufferMinutes = Constants.BUFFER_MINUTES;

    @Min(1)
    private int minDurationMinutes = Constants.MIN_DURATION_MINUTES;

    @Max(24 * 60)
    private int maxDurationMinutes = Constants.MAX_DURATION_MINUTES;

    @Min(0)
    private int maxLookaheadDays = Constants.MAX_LOOKAHEAD_DAYS;

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
