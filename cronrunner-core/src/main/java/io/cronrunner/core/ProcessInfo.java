package io.cronrunner.core;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of an OS process as seen by a {@code ProcessTable}.
 *
 * @param environment may be empty when the environment is not readable (other user, exited)
 */
public record ProcessInfo(
        long pid,
        String command,
        List<String> arguments,
        Map<String, String> environment
) {

    public ProcessInfo {
        arguments = (arguments == null) ? List.of() : List.copyOf(arguments);
        environment = (environment == null) ? Map.of() : Map.copyOf(environment);
    }

    public String commandLine() {
        if (arguments.isEmpty()) {
            return command == null ? "" : command;
        }
        return (command == null ? "" : command) + " " + String.join(" ", arguments);
    }
}
