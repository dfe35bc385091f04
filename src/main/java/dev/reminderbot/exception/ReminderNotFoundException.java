package dev.reminderbot.exception;

import lombok.Getter;

@Getter
public class ReminderNotFoundException extends ReminderBotException {

    private final long reminderId;

    public ReminderNotFoundException(long reminderId) {
        super("Reminder " + reminderId + " does not exist");
        this.reminderId = reminderId;
    }
}
