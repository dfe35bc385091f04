package dev.reminderbot.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Notifier used when no transport is configured: reminders only end up in the log.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "reminder.telegram.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotifier implements Notifier {

    public LoggingNotifier() {
        log.info("Telegram disabled - reminders will only be logged");
    }

    @Override
    public Mono<Boolean> deliver(long recipient, String text) {
        log.info("Reminder for {}: {}", recipient, text);
        return Mono.just(true);
    }
}
