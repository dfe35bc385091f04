package dev.reminderbot.exception;

import lombok.Getter;

@Getter
public class NotOwnerException extends ReminderBotException {

    private final long reminderId;
    private final long caller;

    public NotOwnerException(long reminderId, long caller) {
        super("User " + caller + " does not own reminder " + reminderId);
        this.reminderId = reminderId;
        this.caller = caller;
    }
}
