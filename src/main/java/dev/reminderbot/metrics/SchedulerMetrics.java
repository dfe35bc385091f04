package dev.reminderbot.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the reminder scheduler.
 */
@Component
public class SchedulerMetrics {

    private static final String TAG_COMMAND = "command";
    private final MeterRegistry registry;

    // Counters
    private final Counter remindersFiredCounter;
    private final Counter deliveryFailuresCounter;
    private final Counter unauthorizedSkipsCounter;
    private final Counter scheduleErrorsCounter;
    private final Counter remindersEqualizedCounter;

    private final Timer cycleTimer;

    // Gauges
    private final AtomicInteger lastCycleDue = new AtomicInteger(0);

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.remindersFiredCounter = Counter.builder("reminder_scheduler_reminders_fired_total")
                .description("Reminders delivered and advanced")
                .register(registry);

        this.deliveryFailuresCounter = Counter.builder("reminder_scheduler_delivery_failures_total")
                .description("Deliveries that failed or timed out; the reminder stays due")
                .register(registry);

        this.unauthorizedSkipsCounter = Counter.builder("reminder_scheduler_unauthorized_skips_total")
                .description("Due reminders skipped because their owner is no longer permitted")
                .register(registry);

        this.scheduleErrorsCounter = Counter.builder("reminder_scheduler_schedule_errors_total")
                .description("Reminders whose schedule could not be advanced")
                .register(registry);

        this.remindersEqualizedCounter = Counter.builder("reminder_scheduler_reminders_equalized_total")
                .description("Reminders moved forward by catch-up without firing")
                .register(registry);

        this.cycleTimer = Timer.builder("reminder_scheduler_cycle_duration")
                .description("Time spent resolving and dispatching one poll cycle")
                .register(registry);

        Gauge.builder("reminder_scheduler_last_cycle_due", lastCycleDue, AtomicInteger::get)
                .description("Reminders found due in the last cycle")
                .register(registry);
    }

    public void recordFired() {
        remindersFiredCounter.increment();
    }

    public void recordDeliveryFailure() {
        deliveryFailuresCounter.increment();
    }

    public void recordUnauthorizedSkip() {
        unauthorizedSkipsCounter.increment();
    }

    public void recordScheduleError() {
        scheduleErrorsCounter.increment();
    }

    public void recordEqualized(int count) {
        remindersEqualizedCounter.increment(count);
    }

    public void recordCycle(int due, Duration elapsed) {
        lastCycleDue.set(due);
        cycleTimer.record(elapsed);
    }

    /**
     * Record a handled chat command.
     */
    public void recordCommand(String command) {
        Counter.builder("reminder_scheduler_commands_total")
                .tag(TAG_COMMAND, command)
                .register(registry)
                .increment();
    }
}
