package org.trypticon.regexdfa.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point. The first argument names a command; the rest are passed to it.
 */
public class Main {
    public static void main(String[] args) {
        System.exit(new Main().run(Arrays.asList(args), System.out, System.err));
    }

    /**
     * Dispatches to a command.
     *
     * @param args the command-line arguments.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code.
     */
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            usage(err);
            return 1;
        }

        String first = args.get(0);
        if (first.equals("-h") || first.equals("--help")) {
            usage(out);
            return 0;
        }

        Command command = Commands.findCommand(first);
        if (command == null) {
            Commands.unknownCommand(err, first);
            return 1;
        }
        return command.run(args.subList(1, args.size()), out, err);
    }

    private static void usage(PrintStream stream) {
        stream.println("usage: " + Constants.APP_NAME + " <command> <args...>");
        Commands.availableCommands(stream);
        stream.println("Use " + Constants.APP_NAME + " help <command> for help on a specific command.");
    }
}
