package dev.reminderbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler, authorization and transport settings.
 * Loaded from application.yml under 'reminder' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "reminder")
public class ReminderProperties {

    /** Length of one poll cycle; bounds notification and command latency. */
    private Duration pollInterval = Duration.ofSeconds(60);

    private Duration deliveryTimeout = Duration.ofSeconds(10);

    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * Ids allowed to use the bot. Empty means nobody, a 0 entry means everybody.
     * Kept as raw strings so a malformed entry degrades the policy instead of failing startup.
     */
    private List<String> allowedUsers = new ArrayList<>();

    /** Zone used for wall-clock times; system default when blank. */
    private String zone;

    private Telegram telegram = new Telegram();

    @Data
    public static class Telegram {
        private boolean enabled = false;
        private String token = "";
        private String baseUrl = "https://api.telegram.org";
        private int longPollSeconds = 30;
    }
}
