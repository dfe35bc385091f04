package dev.reminderbot.service;

import dev.reminderbot.model.Reminder;
import dev.reminderbot.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Finds the reminders that should fire now. Read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DueSetResolver {

    private final ReminderStore reminderStore;

    /**
     * @return every unpaused reminder with {@code nextFire <= now}, in store order
     */
    public List<Reminder> resolve(LocalDateTime now) {
        List<Reminder> due = reminderStore.getDue(now);
        log.debug("{} reminder(s) due at {}", due.size(), now);
        return due;
    }
}
