package io.taskhost.worker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers commands from a prefix table instead of a shell. Unmatched commands fail with the
 * configured exit code.
 */
final class RecordingCommandRunner implements CommandRunner {
    private final Map<String, String> outputs = new HashMap<>();
    private final List<String> commands = new ArrayList<>();
    private final List<CommandOptions> options = new ArrayList<>();
    private int failureCode = 100;

    RecordingCommandRunner answer(String prefix, String stdout) {
        outputs.put(prefix, stdout);
        return this;
    }

    RecordingCommandRunner failWith(int code) {
        failureCode = code;
        return this;
    }

    synchronized List<String> commands() {
        return List.copyOf(commands);
    }

    synchronized List<CommandOptions> options() {
        return List.copyOf(options);
    }

    @Override
    public synchronized String run(String commandLine, CommandOptions commandOptions) throws CommandFailedException {
        commands.add(commandLine);
        options.add(commandOptions);
        for (Map.Entry<String, String> entry : outputs.entrySet()) {
            if (commandLine.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        throw new CommandFailedException("'" + commandLine + "' exit=" + failureCode, failureCode);
    }
}
