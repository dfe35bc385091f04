package dev.reminderbot.command;

import dev.reminderbot.config.ReminderProperties;
import dev.reminderbot.telegram.TelegramClient;
import dev.reminderbot.telegram.TelegramClient.Update;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Long-polls Telegram for chat messages during the poll loop's wait window and answers each
 * one through {@link CommandService}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reminder.telegram.enabled", havingValue = "true")
public class TelegramCommandSource implements CommandSource {

    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(5);
    private static final Duration REPLY_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration CONFIRM_TIMEOUT = Duration.ofSeconds(10);
    private static final String MARKDOWN = "Markdown";

    private final TelegramClient telegramClient;
    private final CommandService commandService;
    private final int longPollSeconds;

    // Next update id to request; everything below it has been handled
    private long offset = 0;
    // Last offset Telegram accepted, so updates below it will not be delivered again
    private long confirmedOffset = 0;

    public TelegramCommandSource(TelegramClient telegramClient, CommandService commandService,
                                 ReminderProperties properties) {
        this.telegramClient = telegramClient;
        this.commandService = commandService;
        this.longPollSeconds = Math.max(1, properties.getTelegram().getLongPollSeconds());
    }

    @Override
    public void listen(Duration window) {
        try {
            poll(window);
        } finally {
            if (offset > confirmedOffset) {
                confirmHandled();
            }
        }
    }

    private void poll(Duration window) {
        long deadline = System.nanoTime() + window.toNanos();

        while (!Thread.currentThread().isInterrupted()) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return;
            }
            // Rounded up so the last partial second still long-polls
            long pollSeconds = Math.min(longPollSeconds, (remainingMillis + 999) / 1000);

            List<Update> updates;
            long requested = offset;
            try {
                updates = telegramClient.getUpdates(requested, (int) pollSeconds).block();
            } catch (RuntimeException e) {
                if (Exceptions.unwrap(e) instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    return;
                }
                log.warn("Polling Telegram updates failed: {}", e.getMessage());
                backOff(Math.min(RETRY_BACKOFF.toMillis(), remainingMillis));
                continue;
            }
            confirmedOffset = Math.max(confirmedOffset, requested);

            if (updates != null) {
                for (Update update : updates) {
                    if (Thread.currentThread().isInterrupted()) {
                        // The rest of the batch is delivered again on the next poll
                        return;
                    }
                    handle(update);
                }
            }
        }
    }

    /**
     * Tell Telegram which updates were handled, so they are not replayed after a restart.
     * Runs with the interrupt flag cleared and restores it afterwards.
     */
    private void confirmHandled() {
        boolean interrupted = Thread.interrupted();
        try {
            telegramClient.getUpdates(offset, 0).timeout(CONFIRM_TIMEOUT).block();
            confirmedOffset = offset;
        } catch (RuntimeException e) {
            log.warn("Confirming Telegram updates below {} failed: {}", offset, e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    long getOffset() {
        return offset;
    }

    long getConfirmedOffset() {
        return confirmedOffset;
    }

    private void handle(Update update) {
        offset = Math.max(offset, update.updateId() + 1);
        if (update.message() == null || update.message().text() == null || update.message().chat() == null) {
            log.debug("Ignoring update {} without text", update.updateId());
            return;
        }

        long chatId = update.message().chat().id();
        CommandReply reply;
        try {
            reply = commandService.handle(chatId, update.message().text());
        } catch (RuntimeException e) {
            log.error("Command from {} failed: {}", chatId, e.getMessage(), e);
            reply = CommandReply.plain(CommandService.STORE_FAILURE);
        }

        try {
            Boolean sent = telegramClient.sendMessage(chatId, reply.text(), reply.markdown() ? MARKDOWN : null)
                    .timeout(REPLY_TIMEOUT)
                    .block();
            if (!Boolean.TRUE.equals(sent)) {
                log.warn("Reply to {} was not accepted", chatId);
            }
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return;
            }
            log.warn("Failed to reply to {}: {}", chatId, e.getMessage());
        }
    }

    private void backOff(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
