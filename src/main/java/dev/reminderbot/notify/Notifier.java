package dev.reminderbot.notify;

import reactor.core.publisher.Mono;

/**
 * Delivers reminder payloads to their owner.
 */
public interface Notifier {

    /**
     * Deliver {@code text} verbatim to {@code recipient}.
     *
     * @return Mono<Boolean> indicating success or failure; implementations report transport
     *         failures as {@code false} rather than as an error signal
     */
    Mono<Boolean> deliver(long recipient, String text);
}
