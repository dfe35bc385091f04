package dev.reminderbot.command;

import dev.reminderbot.model.Reminder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Renders a user's reminders as a fixed-width table inside a Markdown code block.
 */
@Component
public class ReminderTableFormatter {

    private static final String FENCE = "```";

    private static final List<Column> COLUMNS = List.of(
            new Column("Id", reminder -> String.valueOf(reminder.getId())),
            new Column("Cron", reminder -> reminder.getSchedule().expression()),
            new Column("Paused", reminder -> String.valueOf(reminder.isPaused())),
            new Column("Next remind", reminder -> reminder.getNextFire().format(CommandParser.DATETIME_FORMAT)),
            new Column("Message", Reminder::getPayload));

    public String format(List<Reminder> reminders) {
        int[] widths = new int[COLUMNS.size()];
        for (int i = 0; i < COLUMNS.size(); i++) {
            Column column = COLUMNS.get(i);
            widths[i] = column.header().length();
            for (Reminder reminder : reminders) {
                widths[i] = Math.max(widths[i], column.value().apply(reminder).length());
            }
        }

        String separator = separator(widths);
        StringBuilder table = new StringBuilder(FENCE).append("\nMy jobs : \n");
        table.append(separator);
        table.append(row(widths, COLUMNS.stream().map(Column::header).toList()));
        table.append(separator);
        for (Reminder reminder : reminders) {
            table.append(row(widths, COLUMNS.stream().map(column -> column.value().apply(reminder)).toList()));
            table.append(separator);
        }
        return table.append(FENCE).toString();
    }

    private String separator(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.append('\n').toString();
    }

    private String row(int[] widths, List<String> cells) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            String cell = cells.get(i);
            line.append(' ').append(" ".repeat(widths[i] - cell.length())).append(cell).append(" |");
        }
        return line.append('\n').toString();
    }

    private record Column(String header, Function<Reminder, String> value) {
    }
}
