package dev.reminderbot.store;

import dev.reminderbot.model.Reminder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keyed record store for reminders. Every single-record operation is atomic; a write based on
 * a stale read fails instead of overwriting a concurrent change.
 * <p>
 * Implementations surface storage outages as unchecked exceptions
 * ({@link org.springframework.dao.DataAccessException} for the JPA store).
 */
public interface ReminderStore {

    Optional<Reminder> get(long id);

    List<Reminder> getAll();

    List<Reminder> getAllFor(long owner);

    /**
     * Unpaused reminders with {@code nextFire <= now}, in ascending id order.
     */
    List<Reminder> getDue(LocalDateTime now);

    /**
     * Unpaused reminders in ascending id order.
     */
    List<Reminder> getActive();

    /**
     * Insert or update the reminder.
     *
     * @return the persisted value, carrying its id and current version
     */
    Reminder put(Reminder reminder);

    void delete(long id);
}
