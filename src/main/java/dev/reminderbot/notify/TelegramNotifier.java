package dev.reminderbot.notify;

import dev.reminderbot.telegram.TelegramClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Delivers reminders as Telegram chat messages; the owner id is the chat id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reminder.telegram.enabled", havingValue = "true")
public class TelegramNotifier implements Notifier {

    private final TelegramClient telegramClient;

    @Override
    public Mono<Boolean> deliver(long recipient, String text) {
        log.info("Sending message to {}", recipient);
        return telegramClient.sendMessage(recipient, text, null)
                .onErrorResume(e -> {
                    log.warn("Failed to send message to {}: {}", recipient, e.getMessage());
                    return Mono.just(false);
                });
    }
}
