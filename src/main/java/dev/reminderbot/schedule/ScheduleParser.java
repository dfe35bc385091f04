package dev.reminderbot.schedule;

import dev.reminderbot.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses schedule expressions: the one-shot tokens, the named aliases and standard
 * 5-field cron rules (minute, hour, day-of-month, month, day-of-week).
 */
@Component
public class ScheduleParser {

    public static final String ONE_SHOT = "@specific";

    private static final Set<String> ONE_SHOT_TOKENS = Set.of(ONE_SHOT, "@once");

    private static final Map<String, String> ALIASES = Map.of(
            "@minutely", "* * * * *",
            "@hourly", "0 * * * *",
            "@daily", "0 0 * * *",
            "@weekly", "0 0 * * 0",
            "@monthly", "0 0 1 * *",
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *");

    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;
    private static final List<String> FIELD_NAMES = List.of("minute", "hour", "day-of-month", "month", "day-of-week");

    // "*" or a value or range, with an optional step. Quartz extensions (? L W #) never match.
    private static final Pattern FIELD_ELEMENT =
            Pattern.compile("^(\\*|(\\d+|[a-z]{3})(-(\\d+|[a-z]{3}))?)(/\\d+)?$");

    /**
     * Parse an expression into a {@link Schedule}.
     *
     * @throws InvalidScheduleException describing why the expression was refused
     */
    public Schedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Schedule expression is empty");
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);

        if (ONE_SHOT_TOKENS.contains(normalized)) {
            return new OneShotSchedule(normalized);
        }

        String rule = ALIASES.get(normalized);
        if (rule == null) {
            if (normalized.startsWith("@")) {
                throw new InvalidScheduleException("Unknown schedule alias '" + normalized + "'");
            }
            rule = String.join(" ", normalized.split("\\s+"));
        }
        return new RecurringSchedule(normalized, rule, compile(rule));
    }

    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    private List<CronExpression> compile(String rule) {
        String[] fields = rule.split(" ");
        if (fields.length != 5) {
            throw new InvalidScheduleException(
                    "Cron rule '" + rule + "' must have 5 fields, found " + fields.length);
        }
        for (int i = 0; i < fields.length; i++) {
            checkField(rule, i, fields[i]);
        }

        boolean domRestricted = !fields[DAY_OF_MONTH].startsWith("*");
        boolean dowRestricted = !fields[DAY_OF_WEEK].startsWith("*");

        List<CronExpression> triggers = new ArrayList<>(2);
        if (domRestricted && dowRestricted) {
            triggers.add(toSpring(rule, fields[0], fields[1], fields[2], fields[3], "*"));
            triggers.add(toSpring(rule, fields[0], fields[1], "*", fields[3], fields[4]));
        } else {
            triggers.add(toSpring(rule, fields[0], fields[1], fields[2], fields[3], fields[4]));
        }
        return triggers;
    }

    /**
     * Validate one field on its own so a refusal names the field as the user wrote it.
     */
    private void checkField(String rule, int index, String field) {
        String[] alone = {"*", "*", "*", "*", "*"};
        alone[index] = field;
        boolean wellFormed = true;
        for (String element : field.split(",", -1)) {
            wellFormed &= FIELD_ELEMENT.matcher(element).matches();
        }
        if (wellFormed && parsesAlone(alone)) {
            return;
        }
        throw new InvalidScheduleException("Cron rule '" + rule + "' has an invalid "
                + FIELD_NAMES.get(index) + " field '" + field + "'");
    }

    private static boolean parsesAlone(String[] fields) {
        try {
            toSpring(fields[0], fields[1], fields[2], fields[3], fields[4]);
            return true;
        } catch (IllegalArgumentException | DateTimeException e) {
            return false;
        }
    }

    private CronExpression toSpring(String rule, String minute, String hour, String dayOfMonth,
                                    String month, String dayOfWeek) {
        try {
            return toSpring(minute, hour, dayOfMonth, month, dayOfWeek);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new InvalidScheduleException("Cron rule '" + rule + "' is invalid", e);
        }
    }

    // Spring expressions carry a leading seconds field, pinned to 0
    private static CronExpression toSpring(String minute, String hour, String dayOfMonth,
                                           String month, String dayOfWeek) {
        return CronExpression.parse(String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek)
                .toUpperCase(Locale.ROOT));
    }
}
