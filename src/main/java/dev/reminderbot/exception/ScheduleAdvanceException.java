package dev.reminderbot.exception;

/**
 * Thrown when a recurrence rule fails to produce a fire time strictly after the previous one.
 * Fatal for the affected reminder only.
 */
public class ScheduleAdvanceException extends ReminderBotException {

    public ScheduleAdvanceException(String message) {
        super(message);
    }
}
