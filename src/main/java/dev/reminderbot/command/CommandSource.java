package dev.reminderbot.command;

import java.time.Duration;

/**
 * Where user commands come from. The poll loop hands control to the source once per cycle.
 */
public interface CommandSource {

    /**
     * Receive and handle commands for up to {@code window}, replying to each one.
     * Returns early, with the thread's interrupt flag set, when the calling thread is interrupted.
     */
    void listen(Duration window);
}
