package dev.reminderbot.schedule;

import dev.reminderbot.exception.ScheduleAdvanceException;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Recurring schedule for a canonical 5-field rule.
 * <p>
 * Holds one {@link CronExpression} per day matcher: when day-of-month and day-of-week are
 * both restricted, cron fires on days matching either field, so the rule is split in two
 * and the earliest candidate wins.
 *
 * @param expression the expression as written (alias or rule)
 * @param rule       the canonical 5-field rule the expression resolves to
 * @param triggers   Spring cron expressions (seconds field pinned to 0) evaluating the rule
 */
public record RecurringSchedule(String expression, String rule, List<CronExpression> triggers) implements Schedule {

    public RecurringSchedule {
        triggers = List.copyOf(triggers);
    }

    @Override
    public boolean isOneShot() {
        return false;
    }

    @Override
    public LocalDateTime nextAfter(LocalDateTime from) {
        LocalDateTime next = null;
        for (CronExpression trigger : triggers) {
            LocalDateTime candidate = trigger.next(from);
            if (candidate != null && (next == null || candidate.isBefore(next))) {
                next = candidate;
            }
        }
        if (next == null || !next.isAfter(from)) {
            throw new ScheduleAdvanceException(
                    "Schedule '" + expression + "' has no occurrence after " + from);
        }
        return next;
    }

    @Override
    public String toString() {
        return expression;
    }
}
