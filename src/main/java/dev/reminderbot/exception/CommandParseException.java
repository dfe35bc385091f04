package dev.reminderbot.exception;

/**
 * Thrown when chat input does not match any known command shape.
 */
public class CommandParseException extends ReminderBotException {

    public CommandParseException(String message) {
        super(message);
    }
}
