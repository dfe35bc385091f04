package dev.reminderbot.service;

import dev.reminderbot.exception.ScheduleAdvanceException;
import dev.reminderbot.metrics.SchedulerMetrics;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.schedule.Schedule;
import dev.reminderbot.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Brings reminders that fell behind the wall clock back to the present without firing them.
 * <p>
 * Runs once over every unpaused reminder when the scheduler starts, and on a single reminder
 * when it is resumed. Skipped occurrences are never reported as due.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatchUpService {

    private final ReminderStore reminderStore;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    /**
     * Advance {@code nextFire} to the first occurrence that is not before {@code now}.
     * One-shot reminders are returned unchanged, and so is a reminder that is already current.
     *
     * @return the caught-up value, not persisted
     * @throws ScheduleAdvanceException if the schedule stops moving forward
     */
    public Reminder equalize(Reminder reminder, LocalDateTime now) {
        if (reminder.isOneShot()) {
            return reminder;
        }

        Schedule schedule = reminder.getSchedule();
        LocalDateTime next = reminder.getNextFire();
        while (next.isBefore(now)) {
            LocalDateTime following = schedule.nextAfter(next);
            if (!following.isAfter(next)) {
                throw new ScheduleAdvanceException("Schedule '" + schedule.expression()
                        + "' of reminder " + reminder.getId() + " did not advance past " + next);
            }
            next = following;
        }

        return next.equals(reminder.getNextFire()) ? reminder : reminder.withNextFire(next);
    }

    /**
     * Equalize every unpaused reminder, writing each moved reminder once.
     * A reminder whose schedule cannot advance is logged and skipped. A store failure
     * aborts the pass and propagates, so the caller can run it again; reminders already
     * written stay current and are not moved twice.
     *
     * @return number of reminders that were moved
     */
    public int equalizeAll() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Reminder> active = reminderStore.getActive();
        int moved = 0;

        for (Reminder reminder : active) {
            try {
                Reminder equalized = equalize(reminder, now);
                if (equalized != reminder) {
                    reminderStore.put(equalized);
                    moved++;
                    log.debug("Reminder {} moved from {} to {}",
                            reminder.getId(), reminder.getNextFire(), equalized.getNextFire());
                }
            } catch (ScheduleAdvanceException e) {
                log.error("Reminder {} skipped during equalize: {}", reminder.getId(), e.getMessage());
                metrics.recordScheduleError();
            }
        }

        metrics.recordEqualized(moved);
        log.info("Equalized {} of {} active reminders", moved, active.size());
        return moved;
    }
}
