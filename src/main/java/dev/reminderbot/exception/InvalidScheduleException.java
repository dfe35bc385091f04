package dev.reminderbot.exception;

/**
 * Thrown when a schedule expression is neither a one-shot token, a known alias
 * nor a valid 5-field cron rule.
 */
public class InvalidScheduleException extends ReminderBotException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
