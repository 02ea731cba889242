package org.trypticon.regexdfa.cli;

import java.io.PrintStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of the commands the tool understands, in the order they are listed.
 */
public class Commands {
    private static final Map<String, Command> COMMANDS = new LinkedHashMap<>();

    static {
        register(new HelpCommand());
        register(new InfoCommand());
        register(new NfaCommand());
        register(new DfaCommand());
    }

    private Commands() {
    }

    private static void register(Command command) {
        COMMANDS.put(command.getName(), command);
    }

    /**
     * Looks up a command.
     *
     * @param name the command name.
     * @return the command, or {@code null} if there is none by that name.
     */
    static Command findCommand(String name) {
        return COMMANDS.get(name);
    }

    static Collection<Command> all() {
        return COMMANDS.values();
    }

    static void unknownCommand(PrintStream err, String command) {
        err.println("Unknown command: " + command);
        availableCommands(err);
    }

    /**
     * Lists every command with its description.
     *
     * @param stream the stream to print to.
     */
    static void availableCommands(PrintStream stream) {
        stream.println("Available commands:");
        for (Command command : all()) {
            stream.println("  " + command.getName() + " - " + command.getDescription());
        }
    }
}
