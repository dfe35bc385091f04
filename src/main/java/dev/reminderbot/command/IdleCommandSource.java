package dev.reminderbot.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Command source used when no chat transport is configured: it only waits out the window.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reminder.telegram.enabled", havingValue = "false", matchIfMissing = true)
public class IdleCommandSource implements CommandSource {

    @Override
    public void listen(Duration window) {
        try {
            Thread.sleep(window.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Idle wait interrupted");
        }
    }
}
