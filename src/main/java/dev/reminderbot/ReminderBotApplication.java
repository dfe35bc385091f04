package dev.reminderbot;

import dev.reminderbot.scheduler.PollLoopDriver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class ReminderBotApplication implements CommandLineRunner {

    private final PollLoopDriver pollLoopDriver;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(ReminderBotApplication.class, args);
    }

    /**
     * Runs the scheduler on the startup thread until the application shuts down.
     */
    @Override
    public void run(String... args) {
        try {
            pollLoopDriver.run();
        } catch (Exception e) {
            log.error("Reminder scheduler failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
