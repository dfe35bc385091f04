package dev.reminderbot.command;

import dev.reminderbot.exception.CommandParseException;
import dev.reminderbot.exception.InvalidScheduleException;
import dev.reminderbot.exception.NotOwnerException;
import dev.reminderbot.exception.ReminderNotFoundException;
import dev.reminderbot.exception.ScheduleAdvanceException;
import dev.reminderbot.metrics.SchedulerMetrics;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.service.AuthorizationService;
import dev.reminderbot.service.ReminderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Validates and executes chat commands on behalf of a user. Every call yields exactly one reply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandService {

    static final String DOCUMENTATION = """
            Possible commands :
            /start - Welcome message
            /help - Help center
            /addjob cron;message[;start_date] - Add a job
            /showjobs - Show my jobs
            /pausejob jobid - Pause the job with id jobid
            /resumejob jobid - Resume the job with id jobid
            /deletejob jobid - Delete the job with id jobid

            In /addjob, the start_date is optional and uses the format dd/mm/yy hh:mm:ss.
            The possible cron values are @specific (reminder at the start date), @minutely, @hourly, \
            @daily, @weekly, @monthly, @yearly, @annually and any valid 5-field cron expression.""";

    static final String WELCOME = "Welcome to reminderBot. I am a bot to send reminders. "
            + "Please see the documentation with the /help command";
    static final String NOT_AUTHORIZED = "You are not authorized to use this bot. Please see /help for more details";
    static final String PARSE_FAILURE = "Failed to parse the command";
    static final String INVALID_SCHEDULE = "The first argument must be a cron valid command "
            + "(including @daily, @hourly, etc...) or @specific";
    static final String NO_UPCOMING_OCCURRENCE = "This schedule has no upcoming occurrence";
    static final String NOT_OWNER = "You are not the owner of this job";
    static final String NOT_FOUND = "This job does not exist";
    static final String NO_JOBS = "You don't have any job";
    static final String STORE_FAILURE = "Something went wrong, please try again later";

    private final CommandParser commandParser;
    private final ReminderService reminderService;
    private final AuthorizationService authorizationService;
    private final ReminderTableFormatter tableFormatter;
    private final SchedulerMetrics metrics;

    /**
     * Handle one chat message from {@code caller}.
     */
    public CommandReply handle(long caller, String text) {
        boolean permitted = authorizationService.isPermitted(caller);

        Command command;
        try {
            command = commandParser.parse(text);
        } catch (CommandParseException e) {
            log.debug("Unparseable input from {}: {}", caller, e.getMessage());
            return CommandReply.plain(permitted ? PARSE_FAILURE : NOT_AUTHORIZED);
        }

        if (!permitted) {
            log.info("Unauthorized user {} tried to use /{}", caller, command.type().getCommand());
            if (command.type() == CommandType.HELP) {
                return CommandReply.plain("You are not authorized to use this bot. "
                        + "Please consider adding your id to the authorized list : " + caller + " (or asking for it)");
            }
            return CommandReply.plain(NOT_AUTHORIZED);
        }

        metrics.recordCommand(command.type().getCommand());
        try {
            return execute(caller, command);
        } catch (InvalidScheduleException e) {
            log.info("User {} sent an invalid schedule: {}", caller, e.getMessage());
            return CommandReply.plain(INVALID_SCHEDULE);
        } catch (ScheduleAdvanceException e) {
            log.warn("User {} hit a schedule without upcoming occurrence: {}", caller, e.getMessage());
            return CommandReply.plain(NO_UPCOMING_OCCURRENCE);
        } catch (ReminderNotFoundException e) {
            log.warn("User {} tried to change inexistent job {}", caller, e.getReminderId());
            return CommandReply.plain(NOT_FOUND);
        } catch (NotOwnerException e) {
            log.warn("User {} is not authorized to modify job {}", caller, e.getReminderId());
            return CommandReply.plain(NOT_OWNER);
        } catch (DataAccessException e) {
            log.error("Store failure while handling /{} from {}: {}",
                    command.type().getCommand(), caller, e.getMessage(), e);
            return CommandReply.plain(STORE_FAILURE);
        }
    }

    private CommandReply execute(long caller, Command command) {
        switch (command.type()) {
            case START:
                return CommandReply.plain(WELCOME);
            case HELP:
                return CommandReply.plain(DOCUMENTATION);
            case ADD_JOB:
                Reminder created = reminderService.create(
                        command.schedule(), command.message(), caller, command.startTime());
                return CommandReply.plain("Job " + created.getId() + " was added");
            case SHOW_JOBS:
                List<Reminder> reminders = reminderService.listFor(caller);
                if (reminders.isEmpty()) {
                    return CommandReply.plain(NO_JOBS);
                }
                return CommandReply.markdown(tableFormatter.format(reminders));
            case PAUSE_JOB:
                reminderService.pause(command.reminderId(), caller);
                return CommandReply.plain("The job " + command.reminderId() + " was paused");
            case RESUME_JOB:
                reminderService.resume(command.reminderId(), caller);
                return CommandReply.plain("The job " + command.reminderId() + " was resumed");
            case DELETE_JOB:
                reminderService.delete(command.reminderId(), caller);
                return CommandReply.plain("The job " + command.reminderId() + " was deleted");
            default:
                throw new IllegalStateException("Unhandled command " + command.type());
        }
    }
}
