package dev.reminderbot.exception;

/**
 * Base type for the failures the scheduler and the command layer report to callers.
 */
public abstract class ReminderBotException extends RuntimeException {

    protected ReminderBotException(String message) {
        super(message);
    }

    protected ReminderBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
