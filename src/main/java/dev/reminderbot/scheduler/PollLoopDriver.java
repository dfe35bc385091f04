package dev.reminderbot.scheduler;

import dev.reminderbot.command.CommandSource;
import dev.reminderbot.config.ReminderProperties;
import dev.reminderbot.exception.ScheduleAdvanceException;
import dev.reminderbot.metrics.SchedulerMetrics;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.notify.Notifier;
import dev.reminderbot.service.AuthorizationService;
import dev.reminderbot.service.CatchUpService;
import dev.reminderbot.service.DueSetResolver;
import dev.reminderbot.service.ReminderService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Top-level scheduling loop.
 * <p>
 * Equalizes every reminder once, then repeats: resolve the due set, deliver and advance each
 * due reminder, wait one poll interval for user commands. A single thread runs the loop, so a
 * pass never starts before the previous one finished. {@link #stop()} ends the loop; it only
 * interrupts the wait, never a delivery or a store write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollLoopDriver {

    private static final String SEPARATOR = "========================================";

    private final CatchUpService catchUpService;
    private final DueSetResolver dueSetResolver;
    private final ReminderService reminderService;
    private final AuthorizationService authorizationService;
    private final Notifier notifier;
    private final CommandSource commandSource;
    private final ReminderProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    private final Object lock = new Object();
    private final CountDownLatch finished = new CountDownLatch(1);

    // Guarded by lock
    private boolean running = false;
    private boolean stopRequested = false;
    private boolean waiting = false;
    private Thread loopThread;

    private boolean equalized = false;

    /**
     * Run until {@link #stop()} is called. Blocks the calling thread.
     */
    public void run() {
        synchronized (lock) {
            if (running || stopRequested) {
                throw new IllegalStateException("Poll loop already started or stopped");
            }
            running = true;
            loopThread = Thread.currentThread();
        }

        log.info(SEPARATOR);
        log.info("Reminder scheduler starting, poll interval {}", properties.getPollInterval());
        log.info(SEPARATOR);

        try {
            while (true) {
                synchronized (lock) {
                    if (stopRequested) {
                        break;
                    }
                }

                runCycle();

                synchronized (lock) {
                    if (stopRequested) {
                        break;
                    }
                    waiting = true;
                }
                try {
                    commandSource.listen(properties.getPollInterval());
                } catch (RuntimeException e) {
                    log.error("Command source failed: {}", e.getMessage(), e);
                } finally {
                    synchronized (lock) {
                        waiting = false;
                        // An interrupt is only ever a stop request; clear it before the next pass
                        Thread.interrupted();
                    }
                }
            }
        } finally {
            synchronized (lock) {
                running = false;
                loopThread = null;
            }
            log.info("Reminder scheduler stopped");
            finished.countDown();
        }
    }

    /**
     * One pass: equalize if that has not succeeded yet, then fire every due reminder.
     *
     * @return number of reminders delivered in this pass
     */
    public int runCycle() {
        if (!equalized) {
            try {
                log.info("Equalizing");
                catchUpService.equalizeAll();
                equalized = true;
            } catch (RuntimeException e) {
                // Firing before equalize succeeds would replay missed occurrences one per cycle
                log.error("Equalize failed, retrying next cycle: {}", e.getMessage(), e);
                return 0;
            }
        }

        long start = System.nanoTime();
        LocalDateTime now = LocalDateTime.now(clock);
        List<Reminder> due;
        try {
            due = dueSetResolver.resolve(now);
        } catch (RuntimeException e) {
            log.error("Unable to resolve due reminders, retrying next cycle: {}", e.getMessage(), e);
            return 0;
        }

        int fired = 0;
        for (Reminder reminder : due) {
            if (fire(reminder)) {
                fired++;
            }
        }

        metrics.recordCycle(due.size(), Duration.ofNanos(System.nanoTime() - start));
        if (!due.isEmpty()) {
            log.info("Cycle at {}: {} due, {} fired", now, due.size(), fired);
        }
        return fired;
    }

    /**
     * Request the loop to end and wait for it to finish its current pass.
     */
    @PreDestroy
    public void stop() {
        boolean wasRunning;
        synchronized (lock) {
            stopRequested = true;
            wasRunning = running;
            if (waiting && loopThread != null) {
                loopThread.interrupt();
            }
        }
        if (!wasRunning) {
            return;
        }

        log.info("Stopping reminder scheduler");
        try {
            if (!finished.await(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Reminder scheduler did not stop within {}", properties.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the reminder scheduler to stop");
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    /**
     * Deliver one reminder and advance it. Failures stay confined to this reminder.
     *
     * @return true if the reminder was delivered and advanced
     */
    private boolean fire(Reminder reminder) {
        try {
            if (!authorizationService.isPermitted(reminder.getOwner())) {
                // Neither fired nor advanced: stays due until the owner is allowed again or it is deleted
                log.warn("Reminder with unauthorized user found. Reminder id : {}", reminder.getId());
                metrics.recordUnauthorizedSkip();
                return false;
            }

            if (!deliver(reminder)) {
                metrics.recordDeliveryFailure();
                return false;
            }

            reminderService.advance(reminder);
            metrics.recordFired();
            return true;
        } catch (ScheduleAdvanceException e) {
            log.error("Reminder {} cannot be advanced and is skipped: {}", reminder.getId(), e.getMessage());
            metrics.recordScheduleError();
        } catch (RuntimeException e) {
            log.error("Failed to process reminder {}: {}", reminder.getId(), e.getMessage(), e);
        }
        return false;
    }

    private boolean deliver(Reminder reminder) {
        Boolean delivered = notifier.deliver(reminder.getOwner(), reminder.getPayload())
                .timeout(properties.getDeliveryTimeout())
                .onErrorResume(e -> {
                    log.warn("Delivery of reminder {} failed: {}", reminder.getId(), e.getMessage());
                    return Mono.just(false);
                })
                .block();

        if (!Boolean.TRUE.equals(delivered)) {
            log.warn("Reminder {} was not delivered, it stays due", reminder.getId());
            return false;
        }
        return true;
    }
}
