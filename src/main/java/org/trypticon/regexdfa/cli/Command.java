package org.trypticon.regexdfa.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * A subcommand of the command-line tool.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String arguments;

    /**
     * @param name the name the command is invoked by.
     * @param description a one-line description for listings.
     * @param arguments summary of the arguments the command takes.
     */
    protected Command(String name, String description, String arguments) {
        this.name = name;
        this.description = description;
        this.arguments = arguments;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Prints the usage line for this command.
     *
     * @param err the error stream.
     */
    void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + arguments);
    }

    /**
     * Prints one line per option the command accepts. Commands without options print nothing.
     *
     * @param err the error stream.
     */
    void options(PrintStream err) {
    }

    /**
     * Prints the full help for this command: its description, usage line and options.
     *
     * @param err the error stream.
     */
    void help(PrintStream err) {
        err.println(Constants.APP_NAME + " " + name + " - " + description);
        usage(err);
        options(err);
    }

    /**
     * Runs the command.
     *
     * @param args the arguments following the command name.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code.
     */
    abstract int run(List<String> args, PrintStream out, PrintStream err);

    /**
     * Prints an exception and each of its causes, one per line.
     *
     * @param err the error stream.
     * @param e the exception.
     */
    static void printErrorSummary(PrintStream err, Exception e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            err.println(t);
        }
    }
}
