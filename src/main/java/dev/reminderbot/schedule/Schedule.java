package dev.reminderbot.schedule;

import java.time.LocalDateTime;

/**
 * A parsed reminder schedule. Either a {@link OneShotSchedule} that fires once at the
 * reminder's start time, or a {@link RecurringSchedule} backed by a 5-field cron rule.
 */
public interface Schedule {

    /**
     * The expression as the user wrote it (trimmed, lower-cased). This is what gets persisted.
     */
    String expression();

    boolean isOneShot();

    /**
     * Earliest fire time strictly after {@code from}.
     *
     * @throws UnsupportedOperationException for one-shot schedules
     * @throws dev.reminderbot.exception.ScheduleAdvanceException if the rule has no later occurrence
     */
    LocalDateTime nextAfter(LocalDateTime from);
}
