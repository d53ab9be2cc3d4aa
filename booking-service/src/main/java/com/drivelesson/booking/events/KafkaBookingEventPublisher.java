package com.drivelesson.booking.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes booking events to Kafka, one topic per event type.
 * <p>
 * Consumers are the messaging side (confirmations, cancellations and reminders
 * over email/WhatsApp) and any reporting read model.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaBookingEventPublisher implements BookingEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "lesson-booking-confirmed";
    static final String TOPIC_BOOKING_CANCELLED = "lesson-booking-cancelled";
    static final String TOPIC_BOOKING_RESCHEDULED = "lesson-booking-rescheduled";
    static final String TOPIC_LESSON_STATUS = "lesson-status-changed";
    static final String TOPIC_LESSON_REMINDER = "lesson-reminder-due";
    static final String TOPIC_DAILY_SUMMARY = "lesson-daily-summary-due";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(BookingEvent event) {
        String topic = topicFor(event);
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, event.partitionKey(), event);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }

    static String topicFor(BookingEvent event) {
        if (event instanceof BookingConfirmedEvent) {
            return TOPIC_BOOKING_CONFIRMED;
        }
        if (event instanceof BookingCancelledEvent) {
            return TOPIC_BOOKING_CANCELLED;
        }
        if (event instanceof BookingRescheduledEvent) {
            return TOPIC_BOOKING_RESCHEDULED;
        }
        if (event instanceof LessonStatusChangedEvent) {
            return TOPIC_LESSON_STATUS;
        }
        if (event instanceof LessonReminderDueEvent) {
            return TOPIC_LESSON_REMINDER;
        }
        if (event instanceof DailySummaryDueEvent) {
            return TOPIC_DAILY_SUMMARY;
        }
        throw new IllegalArgumentException("No topic for event type " + event.getClass().getName());
    }
}
