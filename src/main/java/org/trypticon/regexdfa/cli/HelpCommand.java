package org.trypticon.regexdfa.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints help for one command, or for all of them when none is named.
 */
class HelpCommand extends Command {
    HelpCommand() {
        super("help", "Prints help for a command", "[<command>]");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        switch (args.size()) {
            case 0:
                for (Command command : Commands.all()) {
                    command.usage(err);
                }
                return 0;
            case 1:
                Command named = Commands.findCommand(args.get(0));
                if (named == null) {
                    Commands.unknownCommand(err, args.get(0));
                    return 1;
                }
                named.help(err);
                return 0;
            default:
                usage(err);
                return 1;
        }
    }
}
