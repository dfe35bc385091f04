package dev.reminderbot.scheduler;

import dev.reminderbot.command.CommandSource;
import dev.reminderbot.command.IdleCommandSource;
import dev.reminderbot.config.ReminderProperties;
import dev.reminderbot.exception.ScheduleAdvanceException;
import dev.reminderbot.metrics.SchedulerMetrics;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.notify.Notifier;
import dev.reminderbot.schedule.ScheduleParser;
import dev.reminderbot.service.AuthorizationService;
import dev.reminderbot.service.CatchUpService;
import dev.reminderbot.service.DueSetResolver;
import dev.reminderbot.service.ReminderService;
import dev.reminderbot.support.InMemoryReminderStore;
import dev.reminderbot.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollLoopDriverTest {

    private static final LocalDateTime START = LocalDateTime.parse("2024-01-01T00:00:30");

    @Mock
    private Notifier notifier;

    @Mock
    private CommandSource commandSource;

    private MutableClock clock;
    private InMemoryReminderStore store;
    private MeterRegistry meterRegistry;
    private SchedulerMetrics metrics;
    private ReminderProperties properties;
    private CatchUpService catchUpService;
    private ReminderService reminderService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryReminderStore();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(meterRegistry);

        properties = new ReminderProperties();
        properties.setPollInterval(Duration.ofSeconds(10));
        properties.setDeliveryTimeout(Duration.ofMillis(200));
        properties.setShutdownTimeout(Duration.ofSeconds(5));
        properties.setAllowedUsers(List.of("1", "2"));

        catchUpService = new CatchUpService(store, metrics, clock);
        reminderService = new ReminderService(store, new ScheduleParser(), catchUpService, clock);
    }

    private PollLoopDriver newDriver(CommandSource source) {
        return new PollLoopDriver(catchUpService, new DueSetResolver(store), reminderService,
                new AuthorizationService(properties), notifier, source, properties, metrics, clock);
    }

    private LocalDateTime nextFireOf(Reminder reminder) {
        return store.get(reminder.getId()).orElseThrow().getNextFire();
    }

    private double count(String counter) {
        return meterRegistry.counter(counter).count();
    }

    @Nested
    @DisplayName("Cycle")
    class CycleTests {

        private PollLoopDriver driver;

        @BeforeEach
        void setUp() {
            driver = newDriver(commandSource);
            // First pass equalizes an empty store
            assertThat(driver.runCycle()).isZero();
        }

        @Test
        @DisplayName("Should deliver a due reminder and advance it")
        void shouldDeliverAndAdvance() {
            Reminder reminder = reminderService.create("@minutely", "Tick", 1L, null);
            when(notifier.deliver(1L, "Tick")).thenReturn(Mono.just(true));
            clock.set(LocalDateTime.parse("2024-01-01T00:01:01"));

            int fired = driver.runCycle();

            assertThat(fired).isEqualTo(1);
            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T00:02:00"));
            assertThat(count("reminder_scheduler_reminders_fired_total")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fire a late reminder only once per cycle")
        void shouldFireLateReminderOncePerCycle() {
            Reminder reminder = reminderService.create("@minutely", "Tick", 1L, null);
            when(notifier.deliver(1L, "Tick")).thenReturn(Mono.just(true));
            clock.set(LocalDateTime.parse("2024-01-01T00:05:30"));

            assertThat(driver.runCycle()).isEqualTo(1);

            verify(notifier, times(1)).deliver(1L, "Tick");
            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T00:02:00"));
        }

        @Test
        @DisplayName("Should deliver nothing when nothing is due")
        void shouldDeliverNothingWhenNothingDue() {
            reminderService.create("@daily", "Later", 1L, null);

            assertThat(driver.runCycle()).isZero();

            verify(notifier, never()).deliver(anyLong(), anyString());
        }

        @Test
        @DisplayName("Should keep a reminder due when delivery fails, without affecting others")
        void shouldIsolateDeliveryFailure() {
            Reminder failing = reminderService.create("@minutely", "Fails", 1L, null);
            Reminder working = reminderService.create("@minutely", "Works", 2L, null);
            when(notifier.deliver(1L, "Fails")).thenReturn(Mono.error(new IllegalStateException("chat not found")));
            when(notifier.deliver(2L, "Works")).thenReturn(Mono.just(true));
            clock.set(LocalDateTime.parse("2024-01-01T00:01:01"));

            assertThat(driver.runCycle()).isEqualTo(1);

            assertThat(nextFireOf(failing)).isEqualTo(LocalDateTime.parse("2024-01-01T00:01:00"));
            assertThat(nextFireOf(working)).isEqualTo(LocalDateTime.parse("2024-01-01T00:02:00"));
            assertThat(count("reminder_scheduler_delivery_failures_total")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep a reminder due when the notifier reports failure")
        void shouldKeepDueWhenNotDelivered() {
            Reminder reminder = reminderService.create("@minutely", "Tick", 1L, null);
            when(notifier.deliver(1L, "Tick")).thenReturn(Mono.just(false));
            clock.set(LocalDateTime.parse("2024-01-01T00:01:01"));

            assertThat(driver.runCycle()).isZero();

            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T00:01:00"));
        }

        @Test
        @DisplayName("Should give up on a delivery that exceeds the timeout")
        void shouldTimeOutSlowDelivery() {
            Reminder reminder = reminderService.create("@minutely", "Tick", 1L, null);
            when(notifier.deliver(1L, "Tick")).thenReturn(Mono.never());
            clock.set(LocalDateTime.parse("2024-01-01T00:01:01"));

            assertThat(driver.runCycle()).isZero();

            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T00:01:00"));
        }

        @Test
        @DisplayName("Should deliver and delete a one-shot reminder set in the past")
        void shouldDeliverPastOneShot() {
            Reminder reminder = reminderService.create("@specific", "Dentist", 1L,
                    LocalDateTime.parse("2023-12-31T09:00:00"));
            when(notifier.deliver(1L, "Dentist")).thenReturn(Mono.just(true));

            assertThat(driver.runCycle()).isEqualTo(1);

            assertThat(store.get(reminder.getId())).isEmpty();
        }

        @Test
        @DisplayName("Should skip reminders of users who are no longer allowed, leaving them due")
        void shouldSkipUnauthorizedOwners() {
            Reminder reminder = reminderService.create("@minutely", "Tick", 3L, null);
            clock.set(LocalDateTime.parse("2024-01-01T00:01:01"));

            assertThat(driver.runCycle()).isZero();
            assertThat(driver.runCycle()).isZero();

            verify(notifier, never()).deliver(anyLong(), anyString());
            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T00:01:00"));
            assertThat(count("reminder_scheduler_unauthorized_skips_total")).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Startup catch-up")
    class StartupTests {

        @Test
        @DisplayName("Should move reminders that fell behind without firing them")
        void shouldEqualizeWithoutFiring() {
            Reminder reminder = store.put(Reminder.create(new ScheduleParser().parse("@hourly"), "Missed", 1L,
                    LocalDateTime.parse("2023-12-30T00:00:00"), LocalDateTime.parse("2023-12-30T00:00:00")));

            assertThat(newDriver(commandSource).runCycle()).isZero();

            verify(notifier, never()).deliver(anyLong(), anyString());
            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-01T01:00:00"));
        }

        @Test
        @DisplayName("Should retry catch-up after a failed write instead of replaying the backlog")
        void shouldRetryCatchUpAfterFailedWrite() {
            Reminder reminder = store.put(Reminder.create(new ScheduleParser().parse("@hourly"), "Missed", 1L,
                    LocalDateTime.parse("2023-12-31T23:00:00"), LocalDateTime.parse("2023-12-31T23:00:00")));
            assertThat(reminder.getNextFire()).isEqualTo(LocalDateTime.parse("2024-01-01T00:00:00"));
            clock.set(LocalDateTime.parse("2024-01-03T12:00:30"));
            store.failNextPut(new DataAccessResourceFailureException("database is locked"));
            PollLoopDriver driver = newDriver(commandSource);

            for (int cycle = 0; cycle < 5; cycle++) {
                assertThat(driver.runCycle()).isZero();
                clock.advance(Duration.ofMinutes(1));
            }

            verify(notifier, never()).deliver(anyLong(), anyString());
            assertThat(nextFireOf(reminder)).isEqualTo(LocalDateTime.parse("2024-01-03T13:00:00"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Mock
        private CatchUpService mockCatchUpService;

        @Mock
        private DueSetResolver mockResolver;

        @Mock
        private ReminderService mockReminderService;

        private PollLoopDriver driver;

        @BeforeEach
        void setUp() {
            driver = new PollLoopDriver(mockCatchUpService, mockResolver, mockReminderService,
                    new AuthorizationService(properties), notifier, commandSource, properties, metrics, clock);
        }

        private Reminder due(long id, long owner) {
            return Reminder.builder()
                    .id(id)
                    .createdAt(START)
                    .nextFire(START)
                    .schedule(new ScheduleParser().parse("@minutely"))
                    .payload("reminder " + id)
                    .owner(owner)
                    .version(0L)
                    .build();
        }

        @Test
        @DisplayName("Should not fire anything until catch-up succeeds, then retry it")
        void shouldRetryEqualize() {
            when(mockCatchUpService.equalizeAll())
                    .thenThrow(new DataAccessResourceFailureException("database is locked"))
                    .thenReturn(0);
            when(mockResolver.resolve(any())).thenReturn(List.of());

            assertThat(driver.runCycle()).isZero();
            verify(mockResolver, never()).resolve(any());

            assertThat(driver.runCycle()).isZero();
            assertThat(driver.runCycle()).isZero();
            verify(mockCatchUpService, times(2)).equalizeAll();
            verify(mockResolver, times(2)).resolve(any());
        }

        @Test
        @DisplayName("Should survive a failure to resolve the due set")
        void shouldSurviveResolveFailure() {
            when(mockResolver.resolve(any()))
                    .thenThrow(new DataAccessResourceFailureException("disk I/O error"))
                    .thenReturn(List.of());

            assertThat(driver.runCycle()).isZero();
            assertThat(driver.runCycle()).isZero();
        }

        @Test
        @DisplayName("Should carry on with other reminders when one cannot be advanced")
        void shouldContinueAfterAdvanceFailure() {
            Reminder broken = due(1L, 1L);
            Reminder healthy = due(2L, 2L);
            when(mockResolver.resolve(any())).thenReturn(List.of(broken, healthy));
            when(notifier.deliver(anyLong(), anyString())).thenReturn(Mono.just(true));
            when(mockReminderService.advance(broken)).thenThrow(new ScheduleAdvanceException("no occurrence"));
            when(mockReminderService.advance(healthy)).thenReturn(Optional.of(healthy));

            assertThat(driver.runCycle()).isEqualTo(1);

            assertThat(count("reminder_scheduler_schedule_errors_total")).isEqualTo(1.0);
            verify(notifier).deliver(eq(2L), anyString());
        }

        @Test
        @DisplayName("Should carry on with other reminders when the store rejects a write")
        void shouldContinueAfterStoreFailure() {
            Reminder first = due(1L, 1L);
            Reminder second = due(2L, 1L);
            when(mockResolver.resolve(any())).thenReturn(List.of(first, second));
            when(notifier.deliver(anyLong(), anyString())).thenReturn(Mono.just(true));
            when(mockReminderService.advance(first)).thenThrow(new DataAccessResourceFailureException("locked"));
            when(mockReminderService.advance(second)).thenReturn(Optional.of(second));

            assertThat(driver.runCycle()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should stop promptly while waiting for the next cycle")
        void shouldStopWhileWaiting() throws InterruptedException {
            PollLoopDriver driver = newDriver(new IdleCommandSource());
            Thread loop = new Thread(driver::run, "poll-loop-test");
            loop.start();

            long deadline = System.currentTimeMillis() + 5_000;
            while (!driver.isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(driver.isRunning()).isTrue();

            driver.stop();
            loop.join(5_000);

            assertThat(loop.isAlive()).isFalse();
            assertThat(driver.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should hand the wait window to the command source between cycles")
        void shouldListenBetweenCycles() throws InterruptedException {
            PollLoopDriver driver = newDriver(commandSource);
            List<Duration> windows = new CopyOnWriteArrayList<>();
            AtomicBoolean stopping = new AtomicBoolean(false);
            doAnswer(invocation -> {
                windows.add(invocation.getArgument(0));
                if (windows.size() >= 2 && stopping.compareAndSet(false, true)) {
                    new Thread(driver::stop).start();
                }
                return null;
            }).when(commandSource).listen(any());

            Thread loop = new Thread(driver::run, "poll-loop-test");
            loop.start();
            loop.join(5_000);

            assertThat(loop.isAlive()).isFalse();
            assertThat(windows).hasSizeGreaterThanOrEqualTo(2).allMatch(properties.getPollInterval()::equals);
        }

        @Test
        @DisplayName("Should refuse to start after being stopped")
        void shouldRefuseRestart() {
            PollLoopDriver driver = newDriver(mock(CommandSource.class));

            driver.stop();

            assertThatThrownBy(driver::run).isInstanceOf(IllegalStateException.class);
        }
    }
}
