package dev.reminderbot.schedule;

import java.time.LocalDateTime;

public record OneShotSchedule(String expression) implements Schedule {

    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public LocalDateTime nextAfter(LocalDateTime from) {
        throw new UnsupportedOperationException("One-shot schedule '" + expression + "' has no next occurrence");
    }

    @Override
    public String toString() {
        return expression;
    }
}
