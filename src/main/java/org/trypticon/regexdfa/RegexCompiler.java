package org.trypticon.regexdfa;

import javax.annotation.Nonnull;

import org.trypticon.regexdfa.automaton.Dfa;
import org.trypticon.regexdfa.automaton.Nfa;
import org.trypticon.regexdfa.automaton.TooComplexToDeterminizeException;
import org.trypticon.regexdfa.syntax.InvalidPatternException;
import org.trypticon.regexdfa.syntax.NfaBuilder;
import org.trypticon.regexdfa.syntax.RegExp;

/**
 * Compiles regular expressions into deterministic automata.
 *
 * <p>The resulting {@link Dfa} is unanchored: run from its initial state over a whole input,
 * it ends in a state accepting at end-of-input exactly when the pattern matches somewhere in
 * that input.</p>
 */
public class RegexCompiler {

    private static final String COMPONENT = "RC";

    private final int flags;

    private final int maxStates;

    @Nonnull
    private final InfoStream infoStream;

    /**
     * Constructs a compiler with no flags and the default state limit.
     */
    public RegexCompiler() {
        this(RegExp.NONE);
    }

    public RegexCompiler(int flags) {
        this(flags, Nfa.DEFAULT_MAX_DETERMINIZED_STATES, InfoStream.NO_OUTPUT);
    }

    /**
     * Constructs a compiler.
     *
     * @param flags the {@link RegExp} flags to parse with.
     * @param maxStates the most states either automaton may grow to.
     * @param infoStream where to log progress.
     */
    public RegexCompiler(int flags, int maxStates, @Nonnull InfoStream infoStream) {
        if ((flags & ~RegExp.ALL) != 0) {
            throw new IllegalArgumentException("Illegal flags: " + flags);
        }
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
        }
        this.flags = flags;
        this.maxStates = maxStates;
        this.infoStream = infoStream;
    }

    public int getFlags() {
        return flags;
    }

    /**
     * Returns the most states the automata for a pattern may grow to.
     */
    public int getMaxStates() {
        return maxStates;
    }

    /**
     * Parses a pattern.
     *
     * @param pattern the pattern.
     * @return the parsed expression.
     * @throws InvalidPatternException if the pattern is malformed.
     */
    @Nonnull
    public RegExp parse(@Nonnull String pattern) throws InvalidPatternException {
        RegExp re = new RegExp(pattern, flags);
        infoStream.message(COMPONENT, () -> "parsed " + pattern + " as " + re);
        return re;
    }

    /**
     * Parses a pattern and builds its automaton, predicates and all.
     *
     * @param pattern the pattern.
     * @return the automaton.
     * @throws InvalidPatternException if the pattern is malformed.
     * @throws TooComplexToDeterminizeException if the automaton would need more than the
     *         configured number of states.
     */
    @Nonnull
    public Nfa toNfa(@Nonnull String pattern) throws InvalidPatternException {
        Nfa nfa = build(pattern, parse(pattern));
        infoStream.message(COMPONENT, () -> "built NFA with " + nfa.numStates() + " states and " +
                                            nfa.numPredicates() + " predicates");
        return nfa;
    }

    private Nfa build(String pattern, RegExp re) {
        try {
            return NfaBuilder.build(re, maxStates);
        } catch (TooComplexToDeterminizeException e) {
            throw new TooComplexToDeterminizeException(pattern, e);
        }
    }

    /**
     * Compiles a pattern all the way to a deterministic automaton.
     *
     * @param pattern the pattern.
     * @return the automaton.
     * @throws InvalidPatternException if the pattern is malformed.
     * @throws TooComplexToDeterminizeException if either automaton would need more than the
     *         configured number of states.
     */
    @Nonnull
    public Dfa compile(@Nonnull String pattern) throws InvalidPatternException {
        Nfa nfa = toNfa(pattern);
        try {
            int passes = nfa.removePredicates(maxStates);
            infoStream.message(COMPONENT, () -> "removed predicates in " + passes + " passes, leaving " +
                                                nfa.numStates() + " states");

            Dfa dfa = nfa.determinize(maxStates);
            infoStream.message(COMPONENT, () -> "determinized to " + dfa.numStates() + " states");
            return dfa;
        } catch (TooComplexToDeterminizeException e) {
            throw new TooComplexToDeterminizeException(pattern, e);
        }
    }
}
