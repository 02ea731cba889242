package org.trypticon.regexdfa.syntax;

import org.trypticon.regexdfa.automaton.Nfa;
import org.trypticon.regexdfa.automaton.Predicate;
import org.trypticon.regexdfa.automaton.TooComplexToDeterminizeException;
import org.trypticon.regexdfa.charmap.CharRange;

/**
 * Builds an {@link Nfa} from a {@link RegExp} by Thompson's construction.
 * <p>
 * The result is unanchored at both ends: state 0 and the single accepting state each loop
 * on every code point. Its DFA therefore accepts exactly the inputs that contain a match.
 */
public final class NfaBuilder {

  private final Nfa nfa;
  private final int maxStates;

  private NfaBuilder(Nfa nfa, int maxStates) {
    this.nfa = nfa;
    this.maxStates = maxStates;
  }

  /**
   * Builds with a limit of {@link Nfa#DEFAULT_MAX_STATES} states.
   *
   * @see #build(RegExp, int)
   */
  public static Nfa build(RegExp re) {
    return build(re, Nfa.DEFAULT_MAX_STATES);
  }

  /**
   * Builds the automaton for an expression.
   *
   * @param re the expression.
   * @param maxStates the most states the automaton may have.
   * @throws TooComplexToDeterminizeException if the automaton would need more than
   *         {@code maxStates} states, as large bounded repeats can.
   */
  public static Nfa build(RegExp re, int maxStates) {
    NfaBuilder builder = new NfaBuilder(new Nfa(), maxStates);
    Nfa nfa = builder.nfa;
    int start = builder.newState(false);
    nfa.addTransition(start, start, CharRange.full());
    int entry = builder.newState(false);
    nfa.addEps(start, entry);
    int accept = builder.newState(true);
    nfa.addTransition(accept, accept, CharRange.full());

    builder.compile(re, entry, accept);
    return nfa;
  }

  private int newState(boolean accepting) {
    if (nfa.numStates() >= maxStates) {
      throw new TooComplexToDeterminizeException(nfa, maxStates);
    }
    return nfa.addState(accepting);
  }

  // Adds edges for e between from and to. Never adds an edge into from or out of to.
  private void compile(RegExp e, int from, int to) {
    switch (e.kind) {
      case REGEXP_UNION:
        compile(e.exp1, from, to);
        compile(e.exp2, from, to);
        break;
      case REGEXP_CONCATENATION: {
        int mid = newState(false);
        compile(e.exp1, from, mid);
        compile(e.exp2, mid, to);
        break;
      }
      case REGEXP_OPTIONAL:
        compile(e.exp1, from, to);
        nfa.addEps(from, to);
        break;
      case REGEXP_REPEAT:
        compileStar(e.exp1, from, to);
        break;
      case REGEXP_REPEAT_MIN: {
        int cur = compileCopies(e.exp1, from, e.min);
        compileStar(e.exp1, cur, to);
        break;
      }
      case REGEXP_REPEAT_MINMAX: {
        int cur = compileCopies(e.exp1, from, e.min);
        for (int i = e.min; i < e.max; i++) {
          int next = newState(false);
          compile(e.exp1, cur, next);
          nfa.addEps(cur, to);
          cur = next;
        }
        nfa.addEps(cur, to);
        break;
      }
      case REGEXP_CHAR_CLASS:
        for (CharRange range : e.chars) {
          nfa.addTransition(from, to, range);
        }
        break;
      case REGEXP_EMPTY:
        nfa.addEps(from, to);
        break;
      case REGEXP_BEGIN_TEXT:
        nfa.addPredicate(from, to, Predicate.beginningOfInput());
        break;
      case REGEXP_END_TEXT:
        nfa.addPredicate(from, to, Predicate.endOfInput());
        break;
      case REGEXP_BEGIN_LINE:
        nfa.addPredicate(from, to, Predicate.beginningOfLine());
        break;
      case REGEXP_END_LINE:
        nfa.addPredicate(from, to, Predicate.endOfLine());
        break;
      case REGEXP_WORD_BOUNDARY:
        for (Predicate p : Predicate.wordBoundary()) {
          nfa.addPredicate(from, to, p);
        }
        break;
      case REGEXP_NOT_WORD_BOUNDARY:
        for (Predicate p : Predicate.notWordBoundary()) {
          nfa.addPredicate(from, to, p);
        }
        break;
      default:
        throw new AssertionError("unknown kind: " + e.kind);
    }
  }

  private void compileStar(RegExp e, int from, int to) {
    int loopStart = newState(false);
    int loopEnd = newState(false);
    nfa.addEps(from, loopStart);
    compile(e, loopStart, loopEnd);
    nfa.addEps(loopEnd, loopStart);
    nfa.addEps(loopStart, to);
  }

  /** Chains {@code count} copies of e starting at from, returning the state after the last. */
  private int compileCopies(RegExp e, int from, int count) {
    int cur = from;
    for (int i = 0; i < count; i++) {
      int next = newState(false);
      compile(e, cur, next);
      cur = next;
    }
    return cur;
  }
}
