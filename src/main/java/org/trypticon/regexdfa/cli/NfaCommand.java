package org.trypticon.regexdfa.cli;

import java.io.PrintStream;

import org.trypticon.regexdfa.RegexCompiler;
import org.trypticon.regexdfa.syntax.InvalidPatternException;

/**
 * Command to dump the NFA for a pattern, before predicates are removed.
 */
class NfaCommand extends PatternCommand {
    NfaCommand() {
        super("nfa", "Prints the NFA for a pattern");
    }

    @Override
    void run(RegexCompiler compiler, String pattern, PrintStream out) throws InvalidPatternException {
        out.print(compiler.toNfa(pattern));
    }
}
