package com.drivelesson.booking.config;

import com.drivelesson.availability.config.SchedulingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.validation.beanvalidation.MethodValidationPostProcessor;

import java.time.Clock;

/**
 * Wires the scheduling and booking core. The host application imports this and
 * supplies the storage beans ({@code AvailabilityRepository}, {@code BookingRepository},
 * {@code CreditRepository}) and a {@code KafkaTemplate}.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulingProperties.class)
@ComponentScan(basePackages = {"com.drivelesson.availability", "com.drivelesson.booking"})
public class BookingCoreConfiguration {

    @Bean
    public Clock bookingClock() {
        return Clock.systemUTC();
    }

    /** Enforces {@code @Valid} parameters on {@code @Validated} services. */
    @Bean
    public static MethodValidationPostProcessor bookingMethodValidation() {
        return new MethodValidationPostProcessor();
    }
}
