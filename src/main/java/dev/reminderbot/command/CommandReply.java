package dev.reminderbot.command;

/**
 * Text sent back for one command.
 *
 * @param markdown whether the text must be rendered as Markdown (the job table is)
 */
public record CommandReply(String text, boolean markdown) {

    public static CommandReply plain(String text) {
        return new CommandReply(text, false);
    }

    public static CommandReply markdown(String text) {
        return new CommandReply(text, true);
    }
}
