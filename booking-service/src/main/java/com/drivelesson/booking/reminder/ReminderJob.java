package com.drivelesson.booking.reminder;

import com.drivelesson.availability.config.SchedulingProperties;
import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.domain.repository.BookingRepository;
import com.drivelesson.booking.events.BookingEventPublisher;
import com.drivelesson.booking.events.DailySummaryDueEvent;
import com.drivelesson.booking.events.LessonReminderDueEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;

/**
 * Periodic job that raises reminder events for upcoming lessons:
 * the student about an hour before, the provider about fifteen minutes before,
 * and each provider a summary of the day early in the morning.
 * <p>
 * Works on a snapshot of active bookings; a booking created mid-run is picked up
 * by the next run. A failure on one booking is logged and the run carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderJob {

    private final BookingRepository bookingRepository;
    private final BookingEventPublisher eventPublisher;
    private final SchedulingProperties schedulingProperties;
    private final Clock clock;

    @Value("${booking.reminders.enabled:true}")
    private boolean remindersEnabled;

    @Value("${booking.reminders.student-lead-minutes:60}")
    private int studentLeadMinutes;

    /** Half-width of the student reminder window. */
    @Value("${booking.reminders.student-window-seconds:300}")
    private int studentWindowSeconds;

    @Value("${booking.reminders.provider-lead-minutes:15}")
    private int providerLeadMinutes;

    @Value("${booking.reminders.provider-window-seconds:150}")
    private int providerWindowSeconds;

    @Value("${booking.reminders.daily-summary-hour:5}")
    private int dailySummaryHour;

    @Value("${booking.reminders.daily-summary-window-minutes:10}")
    private int dailySummaryWindowMinutes;

    @Scheduled(fixedDelayString = "${booking.reminders.interval-ms:300000}")
    public void run() {
        if (!remindersEnabled) return;
        Instant now = clock.instant();
        int students = sendStudentReminders(now);
        int providers = sendProviderReminders(now);
        int summaries = sendDailySummaries(now);
        if (students + providers + summaries > 0) {
            log.info("Reminder run: {} student reminder(s), {} provider reminder(s), {} daily summary(ies)",
                    students, providers, summaries);
        }
    }

    int sendStudentReminders(Instant now) {
        return remind(now, studentLeadMinutes, studentWindowSeconds, LessonReminderDueEvent.Recipient.STUDENT,
                LessonBooking::isReminderSent,
                b -> b.toBuilder().reminderSent(true).build());
    }

    int sendProviderReminders(Instant now) {
        return remind(now, providerLeadMinutes, providerWindowSeconds, LessonReminderDueEvent.Recipient.PROVIDER,
                LessonBooking::isProviderReminderSent,
                b -> b.toBuilder().providerReminderSent(true).build());
    }

    int sendDailySummaries(Instant now) {
        ZoneId zone = schedulingProperties.zone();
        ZonedDateTime local = now.atZone(zone);
        LocalTime windowStart = LocalTime.of(dailySummaryHour, 0);
        LocalTime windowEnd = windowStart.plusMinutes(dailySummaryWindowMinutes);
        if (local.toLocalTime().isBefore(windowStart) || !local.toLocalTime().isBefore(windowEnd)) {
            return 0;
        }

        LocalDate today = local.toLocalDate();
        Map<Long, List<LessonBooking>> byProvider = bookingRepository
                .findActiveStartingBetween(today.atStartOfDay(zone).toInstant(), today.plusDays(1).atStartOfDay(zone).toInstant())
                .stream()
                .filter(b -> b.isActive() && !b.isDailySummarySent())
                .sorted(Comparator.comparing(LessonBooking::getLessonStart))
                .collect(groupingBy(LessonBooking::getProviderId, TreeMap::new, toList()));

        int sent = 0;
        for (Map.Entry<Long, List<LessonBooking>> entry : byProvider.entrySet()) {
            try {
                List<LessonBooking> lessons = entry.getValue();
                eventPublisher.publish(DailySummaryDueEvent.builder()
                        .providerId(entry.getKey())
                        .date(today)
                        .bookingIds(lessons.stream().map(LessonBooking::getId).toList())
                        .lessonStarts(lessons.stream().map(LessonBooking::getLessonStart).toList())
                        .timestamp(now)
                        .build());
                for (LessonBooking lesson : lessons) {
                    bookingRepository.updateBooking(lesson.toBuilder().dailySummarySent(true).build());
                }
                sent++;
            } catch (Exception e) {
                log.error("Daily summary failed for provider {}", entry.getKey(), e);
            }
        }
        return sent;
    }

    private int remind(Instant now, int leadMinutes, int windowSeconds, LessonReminderDueEvent.Recipient recipient,
                       Predicate<LessonBooking> alreadySent, Function<LessonBooking, LessonBooking> markSent) {
        Instant target = now.plus(Duration.ofMinutes(leadMinutes));
        List<LessonBooking> due = bookingRepository.findActiveStartingBetween(
                target.minusSeconds(windowSeconds), target.plusSeconds(windowSeconds));
        int sent = 0;
        for (LessonBooking booking : due) {
            if (!booking.isActive() || alreadySent.test(booking)) {
                continue;
            }
            try {
                eventPublisher.publish(LessonReminderDueEvent.builder()
                        .bookingId(booking.getId())
                        .reference(booking.getReference())
                        .recipient(recipient)
                        .recipientId(recipient == LessonReminderDueEvent.Recipient.STUDENT
                                ? booking.getStudentId()
                                : booking.getProviderId())
                        .lessonStart(booking.getLessonStart())
                        .minutesUntilStart(Duration.between(now, booking.getLessonStart()).toMinutes())
                        .timestamp(now)
                        .build());
                bookingRepository.updateBooking(markSent.apply(booking));
                sent++;
            } catch (Exception e) {
                log.error("{} reminder failed for booking {}", recipient, booking.getId(), e);
            }
        }
        return sent;
    }
}
