package dev.reminderbot.command;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum CommandType {
    START("start"),
    HELP("help"),
    ADD_JOB("addjob"),
    SHOW_JOBS("showjobs"),
    PAUSE_JOB("pausejob"),
    RESUME_JOB("resumejob"),
    DELETE_JOB("deletejob");

    private final String command;

    public static Optional<CommandType> fromCommand(String command) {
        return Arrays.stream(values())
                .filter(type -> type.command.equalsIgnoreCase(command))
                .findFirst();
    }
}
