package com.drivelesson.booking.completion;

import com.drivelesson.booking.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodically completes bookings whose lesson has ended, so they drop out of the
 * active set and out of reminder scans.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LessonCompletionJob {

    private final BookingService bookingService;
    private final Clock clock;

    @Value("${booking.completion.enabled:true}")
    private boolean completionEnabled;

    /** How far back the sweep looks for lessons that were never closed. */
    @Value("${booking.completion.lookback-days:30}")
    private int lookbackDays;

    @Scheduled(fixedDelayString = "${booking.completion.interval-ms:600000}")
    public void run() {
        if (!completionEnabled) return;
        int completed = bookingService.completeFinishedLessons(clock.instant().minus(Duration.ofDays(lookbackDays)));
        log.debug("Lesson completion run closed {} booking(s)", completed);
    }
}
