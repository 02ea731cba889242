package org.trypticon.regexdfa.cli;

import java.io.PrintStream;

import org.trypticon.regexdfa.RegexCompiler;
import org.trypticon.regexdfa.automaton.Dfa;
import org.trypticon.regexdfa.automaton.Nfa;
import org.trypticon.regexdfa.syntax.InvalidPatternException;

/**
 * Command to show the size of a pattern's automata at each stage.
 */
class InfoCommand extends PatternCommand {
    InfoCommand() {
        super("info", "Gives the sizes of the automata for a pattern");
    }

    @Override
    void run(RegexCompiler compiler, String pattern, PrintStream out) throws InvalidPatternException {
        Nfa nfa = compiler.toNfa(pattern);
        out.println("NFA states: " + nfa.numStates());
        out.println("NFA predicates: " + nfa.numPredicates());

        int passes = nfa.removePredicates(compiler.getMaxStates());
        out.println("Predicate elimination passes: " + passes);
        out.println("NFA states without predicates: " + nfa.numStates());

        Dfa dfa = nfa.determinize(compiler.getMaxStates());
        out.println("DFA states: " + dfa.numStates());
        out.println("DFA transitions: " + dfa.getNumTransitions());
    }
}
