package org.trypticon.regexdfa.cli;

import java.io.PrintStream;
import java.util.List;

import org.trypticon.regexdfa.InfoStream;
import org.trypticon.regexdfa.PrintStreamInfoStream;
import org.trypticon.regexdfa.RegexCompiler;
import org.trypticon.regexdfa.automaton.Nfa;
import org.trypticon.regexdfa.automaton.TooComplexToDeterminizeException;
import org.trypticon.regexdfa.syntax.InvalidPatternException;
import org.trypticon.regexdfa.syntax.RegExp;

/**
 * Base class for commands which take compile options and a single pattern.
 */
abstract class PatternCommand extends Command {
    protected PatternCommand(String name, String description) {
        super(name, description, "[-i] [-m] [-s] [-v] [--] <pattern>");
    }

    @Override
    void options(PrintStream err) {
        err.println("  -i  case-insensitive matching of ASCII letters");
        err.println("  -m  ^ and $ also match at line breaks");
        err.println("  -s  . also matches line breaks");
        err.println("  -v  log compilation progress to stderr");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        int flags = RegExp.NONE;
        InfoStream infoStream = InfoStream.NO_OUTPUT;
        int i = 0;
        for (; i < args.size() && args.get(i).startsWith("-"); i++) {
            String option = args.get(i);
            if (option.equals("--")) {
                i++;
                break;
            }
            switch (option) {
                case "-i":
                    flags |= RegExp.CASE_INSENSITIVE;
                    break;
                case "-m":
                    flags |= RegExp.MULTI_LINE;
                    break;
                case "-s":
                    flags |= RegExp.DOT_ALL;
                    break;
                case "-v":
                    infoStream = new PrintStreamInfoStream(err);
                    break;
                default:
                    err.println("Unknown option: " + option);
                    usage(err);
                    return 1;
            }
        }
        if (args.size() - i != 1) {
            usage(err);
            return 1;
        }

        String pattern = args.get(i);
        RegexCompiler compiler = new RegexCompiler(flags, Nfa.DEFAULT_MAX_DETERMINIZED_STATES, infoStream);
        try {
            run(compiler, pattern, out);
            return 0;
        } catch (InvalidPatternException e) {
            err.println("Invalid pattern: " + pattern);
            printErrorSummary(err, e);
            return 1;
        } catch (TooComplexToDeterminizeException e) {
            err.println("Pattern too complex: " + pattern);
            printErrorSummary(err, e);
            return 1;
        }
    }

    /**
     * Runs the command on a pattern.
     *
     * @param compiler the compiler, configured from the options.
     * @param pattern the pattern.
     * @param out the output stream.
     * @throws InvalidPatternException if the pattern is malformed.
     */
    abstract void run(RegexCompiler compiler, String pattern, PrintStream out) throws InvalidPatternException;
}
