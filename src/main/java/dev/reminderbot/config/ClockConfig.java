package dev.reminderbot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Provides the wall clock every scheduling decision is made against.
 */
@Slf4j
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(ReminderProperties properties) {
        String zone = properties.getZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        log.info("Using time zone {}", zone);
        return Clock.system(ZoneId.of(zone));
    }
}
