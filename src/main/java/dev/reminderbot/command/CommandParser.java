package dev.reminderbot.command;

import dev.reminderbot.exception.CommandParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns chat text into a {@link Command}.
 * <pre>
 * /addjob cron;message[;dd/MM/yy HH:mm:ss]
 * /pausejob id   /resumejob id   /deletejob id
 * /showjobs   /start   /help
 * </pre>
 * A command may carry a bot mention suffix, e.g. {@code /addjob@my_bot}.
 */
@Slf4j
@Component
public class CommandParser {

    // Strict: impossible dates such as 31/02 fail to parse
    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("dd/MM/uu HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern COMMAND = Pattern.compile("^/(\\w+)(@\\S*)?(?:\\s(.*))?$", Pattern.DOTALL);
    private static final Pattern REMINDER_ID = Pattern.compile("^\\d{1,18}$");
    private static final String FIELD_SEPARATOR = ";";

    /**
     * @throws CommandParseException if the text is not a well-formed command
     */
    public Command parse(String text) {
        if (text == null) {
            throw new CommandParseException("Empty command");
        }
        Matcher matcher = COMMAND.matcher(text.strip());
        if (!matcher.matches()) {
            throw new CommandParseException("Not a command: " + text);
        }

        CommandType type = CommandType.fromCommand(matcher.group(1))
                .orElseThrow(() -> new CommandParseException("Unknown command /" + matcher.group(1)));
        String arguments = matcher.group(3) != null ? matcher.group(3) : "";

        switch (type) {
            case ADD_JOB:
                return parseAddJob(arguments);
            case PAUSE_JOB:
            case RESUME_JOB:
            case DELETE_JOB:
                return Command.forReminder(type, parseReminderId(arguments));
            default:
                return Command.of(type);
        }
    }

    private Command parseAddJob(String arguments) {
        String[] parts = arguments.split(FIELD_SEPARATOR, -1);
        if (parts.length != 2 && parts.length != 3) {
            throw new CommandParseException("Expected cron;message[;start_date] but got: " + arguments);
        }

        String schedule = parts[0].trim();
        String message = parts[1];
        if (schedule.isEmpty() || message.isBlank()) {
            throw new CommandParseException("Schedule and message must not be empty");
        }

        LocalDateTime startTime = null;
        if (parts.length == 3) {
            try {
                startTime = LocalDateTime.parse(parts[2].trim(), DATETIME_FORMAT);
            } catch (DateTimeParseException e) {
                log.info("Date '{}' couldn't be parsed. Using now", parts[2].trim());
            }
        }
        return Command.addJob(schedule, message, startTime);
    }

    private long parseReminderId(String arguments) {
        String id = arguments.trim();
        if (!REMINDER_ID.matcher(id).matches()) {
            throw new CommandParseException("Expected a job id but got: " + arguments);
        }
        return Long.parseLong(id);
    }
}
