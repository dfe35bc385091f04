package dev.reminderbot.model;

import dev.reminderbot.schedule.Schedule;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;

/**
 * One reminder. Immutable: every state transition returns a new value that the caller
 * persists through {@link dev.reminderbot.store.ReminderStore#put(Reminder)}.
 * <p>
 * A reminder is due when it is not paused and {@code nextFire} is not after the current time.
 */
@Value
@With
@Builder(toBuilder = true)
public class Reminder {

    /** Store-assigned id, {@code null} until first persisted. */
    Long id;

    @NonNull
    LocalDateTime createdAt;

    @NonNull
    LocalDateTime nextFire;

    @NonNull
    Schedule schedule;

    @NonNull
    String payload;

    long owner;

    boolean paused;

    /** Optimistic-lock version maintained by the store. */
    Long version;

    /**
     * Create a new active reminder.
     * <p>
     * Recurring schedules start at the first occurrence strictly after {@code startHint}, so a
     * reminder created "now" is never immediately due. One-shot schedules fire at
     * {@code startHint} itself, which may already be in the past.
     */
    public static Reminder create(Schedule schedule, String payload, long owner,
                                  LocalDateTime startHint, LocalDateTime createdAt) {
        LocalDateTime nextFire = schedule.isOneShot() ? startHint : schedule.nextAfter(startHint);
        return Reminder.builder()
                .createdAt(createdAt)
                .nextFire(nextFire)
                .schedule(schedule)
                .payload(payload)
                .owner(owner)
                .paused(false)
                .build();
    }

    public boolean isOneShot() {
        return schedule.isOneShot();
    }

    public boolean isDue(LocalDateTime now) {
        return !paused && !nextFire.isAfter(now);
    }

    /**
     * Move to the next occurrence after the current {@code nextFire}. Only meaningful after a fire.
     *
     * @throws IllegalStateException for one-shot reminders, which are deleted instead
     */
    public Reminder advance() {
        if (isOneShot()) {
            throw new IllegalStateException("One-shot reminder " + id + " cannot be advanced");
        }
        return withNextFire(schedule.nextAfter(nextFire));
    }

    public Reminder pause() {
        return withPaused(true);
    }

    /**
     * Clear the paused flag. The caller is responsible for catching {@code nextFire} up first.
     */
    public Reminder resume() {
        return withPaused(false);
    }
}
