package com.drivelesson.booking.reminder;

import com.drivelesson.availability.config.SchedulingProperties;
import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.domain.model.PaymentStatus;
import com.drivelesson.booking.domain.repository.BookingRepository;
import com.drivelesson.booking.events.BookingEvent;
import com.drivelesson.booking.events.BookingEventPublisher;
import com.drivelesson.booking.events.DailySummaryDueEvent;
import com.drivelesson.booking.events.LessonReminderDueEvent;
import com.drivelesson.common.model.BookingStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ReminderJob}. Times are UTC; lessons run in SAST (UTC+2).
 */
@ExtendWith(MockitoExtension.class)
class ReminderJobTest {

    // 08:15 SAST
    private static final Instant MORNING = Instant.parse("2026-03-02T06:15:00Z");
    // 05:05 SAST
    private static final Instant EARLY = Instant.parse("2026-03-02T03:05:00Z");

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingEventPublisher eventPublisher;

    private ReminderJob job(Instant now) {
        ReminderJob job = new ReminderJob(bookingRepository, eventPublisher, new SchedulingProperties(),
                Clock.fixed(now, ZoneOffset.UTC));
        ReflectionTestUtils.setField(job, "remindersEnabled", true);
        ReflectionTestUtils.setField(job, "studentLeadMinutes", 60);
        ReflectionTestUtils.setField(job, "studentWindowSeconds", 300);
        ReflectionTestUtils.setField(job, "providerLeadMinutes", 15);
        ReflectionTestUtils.setField(job, "providerWindowSeconds", 150);
        ReflectionTestUtils.setField(job, "dailySummaryHour", 5);
        ReflectionTestUtils.setField(job, "dailySummaryWindowMinutes", 10);
        return job;
    }

    private static LessonBooking lesson(long id, long providerId, Instant start) {
        return LessonBooking.builder()
                .id(id)
                .reference("BK0000000" + id)
                .studentId(100L + id)
                .providerId(providerId)
                .lessonStart(start)
                .durationMinutes(60)
                .status(BookingStatus.CONFIRMED)
                .paymentStatus(PaymentStatus.PAID)
                .amount(new BigDecimal("350.00"))
                .build();
    }

    @Test
    @DisplayName("student reminder goes out once for lessons about an hour away")
    void studentReminders() {
        // given
        Instant start = MORNING.plusSeconds(3600);
        LessonBooking due = lesson(1L, 7L, start);
        LessonBooking alreadyReminded = lesson(2L, 7L, start).toBuilder().reminderSent(true).build();
        when(bookingRepository.findActiveStartingBetween(start.minusSeconds(300), start.plusSeconds(300)))
                .thenReturn(List.of(due, alreadyReminded));

        // when
        int sent = job(MORNING).sendStudentReminders(MORNING);

        // then
        assertThat(sent).isEqualTo(1);
        ArgumentCaptor<BookingEvent> event = ArgumentCaptor.forClass(BookingEvent.class);
        verify(eventPublisher).publish(event.capture());
        LessonReminderDueEvent reminder = (LessonReminderDueEvent) event.getValue();
        assertThat(reminder.getRecipient()).isEqualTo(LessonReminderDueEvent.Recipient.STUDENT);
        assertThat(reminder.getRecipientId()).isEqualTo(101L);
        assertThat(reminder.getMinutesUntilStart()).isEqualTo(60);

        ArgumentCaptor<LessonBooking> updated = ArgumentCaptor.forClass(LessonBooking.class);
        verify(bookingRepository).updateBooking(updated.capture());
        assertThat(updated.getValue().isReminderSent()).isTrue();
    }

    @Test
    @DisplayName("one failing provider reminder does not stop the others")
    void providerReminders_continueAfterFailure() {
        // given
        Instant start = MORNING.plusSeconds(15 * 60);
        LessonBooking first = lesson(1L, 7L, start);
        LessonBooking second = lesson(2L, 8L, start);
        when(bookingRepository.findActiveStartingBetween(start.minusSeconds(150), start.plusSeconds(150)))
                .thenReturn(List.of(first, second));
        doThrow(new IllegalStateException("broker down")).doNothing().when(eventPublisher).publish(any());

        // when
        int sent = job(MORNING).sendProviderReminders(MORNING);

        // then
        assertThat(sent).isEqualTo(1);
        ArgumentCaptor<LessonBooking> updated = ArgumentCaptor.forClass(LessonBooking.class);
        verify(bookingRepository).updateBooking(updated.capture());
        assertThat(updated.getValue().getId()).isEqualTo(2L);
        assertThat(updated.getValue().isProviderReminderSent()).isTrue();
    }

    @Test
    @DisplayName("daily summary groups today's lessons by provider inside the 05:00 window")
    void dailySummaries() {
        // given: 2026-03-02 00:00 SAST to 2026-03-03 00:00 SAST
        Instant dayStart = Instant.parse("2026-03-01T22:00:00Z");
        Instant dayEnd = Instant.parse("2026-03-02T22:00:00Z");
        when(bookingRepository.findActiveStartingBetween(dayStart, dayEnd)).thenReturn(List.of(
                lesson(3L, 7L, Instant.parse("2026-03-02T10:00:00Z")),
                lesson(1L, 7L, Instant.parse("2026-03-02T06:00:00Z")),
                lesson(2L, 8L, Instant.parse("2026-03-02T08:00:00Z")),
                lesson(4L, 8L, Instant.parse("2026-03-02T09:00:00Z")).toBuilder().dailySummarySent(true).build()));

        // when
        int sent = job(EARLY).sendDailySummaries(EARLY);

        // then
        assertThat(sent).isEqualTo(2);
        ArgumentCaptor<BookingEvent> events = ArgumentCaptor.forClass(BookingEvent.class);
        verify(eventPublisher, times(2)).publish(events.capture());
        DailySummaryDueEvent first = (DailySummaryDueEvent) events.getAllValues().get(0);
        assertThat(first.getProviderId()).isEqualTo(7L);
        assertThat(first.getBookingIds()).containsExactly(1L, 3L);
        DailySummaryDueEvent second = (DailySummaryDueEvent) events.getAllValues().get(1);
        assertThat(second.getBookingIds()).containsExactly(2L);
        verify(bookingRepository, times(3)).updateBooking(any());
    }

    @Test
    @DisplayName("no daily summary outside the morning window")
    void dailySummaries_outsideWindow() {
        assertThat(job(MORNING).sendDailySummaries(MORNING)).isZero();
        verify(bookingRepository, never()).findActiveStartingBetween(any(), any());
    }

    @Test
    @DisplayName("disabled job does nothing")
    void disabled() {
        // given
        ReminderJob job = job(MORNING);
        ReflectionTestUtils.setField(job, "remindersEnabled", false);

        // when
        job.run();

        // then
        verifyNoInteractions(bookingRepository, eventPublisher);
    }
}
