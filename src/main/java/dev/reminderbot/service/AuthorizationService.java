package dev.reminderbot.service;

import dev.reminderbot.config.ReminderProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides who may use the bot and receive reminders.
 * <p>
 * The policy comes from {@code reminder.allowed-users}: an empty list allows nobody, a list
 * containing {@code 0} allows everybody, anything else is an allow-list. A list that does not
 * parse falls back to allowing nobody.
 */
@Slf4j
@Service
public class AuthorizationService {

    public enum UserPolicy {
        NONE,
        ALL,
        SOME
    }

    private static final long EVERYONE = 0L;

    @Getter
    private final UserPolicy policy;

    @Getter
    private final Set<Long> allowedUsers;

    public AuthorizationService(ReminderProperties properties) {
        List<String> raw = properties.getAllowedUsers().stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();

        UserPolicy resolvedPolicy;
        Set<Long> resolvedUsers;
        if (raw.isEmpty()) {
            resolvedPolicy = UserPolicy.NONE;
            resolvedUsers = Set.of();
        } else {
            try {
                resolvedUsers = raw.stream().map(Long::parseLong).collect(Collectors.toUnmodifiableSet());
                resolvedPolicy = resolvedUsers.contains(EVERYONE) ? UserPolicy.ALL : UserPolicy.SOME;
            } catch (NumberFormatException e) {
                log.warn("Unable to parse the allowed users {}. Falling back on no user allowed.", raw);
                resolvedPolicy = UserPolicy.NONE;
                resolvedUsers = Set.of();
            }
        }

        this.policy = resolvedPolicy;
        this.allowedUsers = resolvedUsers;
        log.info("User policy: {} ({} explicit user(s))", policy, allowedUsers.size());
    }

    public boolean isPermitted(long user) {
        if (policy == UserPolicy.ALL) {
            return true;
        }
        return policy == UserPolicy.SOME && allowedUsers.contains(user);
    }
}
