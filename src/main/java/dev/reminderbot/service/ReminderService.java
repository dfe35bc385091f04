package dev.reminderbot.service;

import dev.reminderbot.exception.NotOwnerException;
import dev.reminderbot.exception.ReminderNotFoundException;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.schedule.Schedule;
import dev.reminderbot.schedule.ScheduleParser;
import dev.reminderbot.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reminder lifecycle: create, advance after a fire, pause, resume, delete.
 * Every transition is written to the store before returning; none of them delivers anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderService {

    private final ReminderStore reminderStore;
    private final ScheduleParser scheduleParser;
    private final CatchUpService catchUpService;
    private final Clock clock;

    /**
     * Validate the schedule and store a new active reminder.
     *
     * @param startHint when the reminder should start; {@code null} means now
     * @throws dev.reminderbot.exception.InvalidScheduleException if the expression is refused
     */
    public Reminder create(String expression, String payload, long owner, LocalDateTime startHint) {
        Schedule schedule = scheduleParser.parse(expression);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime start = startHint != null ? startHint : now;

        Reminder created = reminderStore.put(Reminder.create(schedule, payload, owner, start, now));
        log.info("User {} created reminder {} ({}), first fire at {}",
                owner, created.getId(), schedule.expression(), created.getNextFire());
        return created;
    }

    /**
     * Called after a reminder fired: one-shot reminders are deleted, recurring ones move to
     * their next occurrence.
     *
     * @return the advanced reminder, or empty if it was deleted
     */
    public Optional<Reminder> advance(Reminder reminder) {
        if (reminder.isOneShot()) {
            reminderStore.delete(reminder.getId());
            log.debug("One-shot reminder {} fired and was deleted", reminder.getId());
            return Optional.empty();
        }
        Reminder advanced = reminderStore.put(reminder.advance());
        log.debug("Reminder {} advanced to {}", advanced.getId(), advanced.getNextFire());
        return Optional.of(advanced);
    }

    public Reminder pause(long id, long caller) {
        Reminder paused = reminderStore.put(findOwned(id, caller).pause());
        log.info("User {} has paused reminder {}", caller, id);
        return paused;
    }

    /**
     * Catch the reminder up to the present, then clear its paused flag, in one write.
     */
    public Reminder resume(long id, long caller) {
        Reminder reminder = findOwned(id, caller);
        Reminder caughtUp = catchUpService.equalize(reminder, LocalDateTime.now(clock));
        Reminder resumed = reminderStore.put(caughtUp.resume());
        log.info("User {} has resumed reminder {}, next fire at {}", caller, id, resumed.getNextFire());
        return resumed;
    }

    public void delete(long id, long caller) {
        findOwned(id, caller);
        reminderStore.delete(id);
        log.info("User {} has deleted reminder {}", caller, id);
    }

    public List<Reminder> listFor(long owner) {
        return reminderStore.getAllFor(owner);
    }

    private Reminder findOwned(long id, long caller) {
        Reminder reminder = reminderStore.get(id)
                .orElseThrow(() -> new ReminderNotFoundException(id));
        if (reminder.getOwner() != caller) {
            throw new NotOwnerException(id, caller);
        }
        return reminder;
    }
}
