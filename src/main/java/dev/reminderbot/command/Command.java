package dev.reminderbot.command;

import java.time.LocalDateTime;

/**
 * A parsed chat command. Only the fields relevant to {@code type} are set.
 *
 * @param reminderId target of pause/resume/delete
 * @param schedule   schedule expression of an addjob
 * @param message    reminder text of an addjob
 * @param startTime  optional start of an addjob; {@code null} means now
 */
public record Command(CommandType type, Long reminderId, String schedule, String message,
                      LocalDateTime startTime) {

    public static Command of(CommandType type) {
        return new Command(type, null, null, null, null);
    }

    public static Command forReminder(CommandType type, long reminderId) {
        return new Command(type, reminderId, null, null, null);
    }

    public static Command addJob(String schedule, String message, LocalDateTime startTime) {
        return new Command(CommandType.ADD_JOB, null, schedule, message, startTime);
    }
}
