package org.trypticon.regexdfa.cli;

import java.io.PrintStream;

import org.trypticon.regexdfa.RegexCompiler;
import org.trypticon.regexdfa.syntax.InvalidPatternException;

/**
 * Command to print the DFA for a pattern in Graphviz dot format.
 */
class DfaCommand extends PatternCommand {
    DfaCommand() {
        super("dfa", "Prints the DFA for a pattern as a Graphviz graph");
    }

    @Override
    void run(RegexCompiler compiler, String pattern, PrintStream out) throws InvalidPatternException {
        out.println(compiler.compile(pattern).toDot());
    }
}
