package org.trypticon.regexdfa.automaton;

import org.junit.Test;
import org.trypticon.regexdfa.charmap.CharRange;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.trypticon.regexdfa.automaton.DfaRunner.accepts;

/**
 * Tests for {@link Nfa#removePredicates()}, on automata shaped the way the pattern builder
 * makes them: state 0 loops on everything and steps to the entry state, and the accepting
 * state loops on everything too.
 */
public class PredicateRemovalTests {
  private static final int ENTRY = 1;
  private static final int ACCEPT = 2;

  @Test
  public void testNoPredicates() {
    Nfa nfa = unanchored();
    nfa.addTransition(ENTRY, ACCEPT, CharRange.single('a'));
    assertThat(nfa.removePredicates(), is(0));
    assertThat(nfa.numStates(), is(3));
  }

  @Test
  public void testBeginningOfInput() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    nfa.addPredicate(ENTRY, mid, Predicate.beginningOfInput());
    nfa.addTransition(mid, ACCEPT, CharRange.single('a'));

    assertThat(nfa.removePredicates(), is(1));
    assertThat(nfa.numPredicates(), is(0));
    assertThat(nfa.isAnchored(nfa.numStates() - 1), is(true));

    Dfa dfa = nfa.determinize();
    assertThat(accepts(dfa, "a"), is(true));
    assertThat(accepts(dfa, "ab"), is(true));
    assertThat(accepts(dfa, "ba"), is(false));
    assertThat(accepts(dfa, ""), is(false));
  }

  @Test
  public void testEndOfInput() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    nfa.addTransition(ENTRY, mid, CharRange.single('a'));
    nfa.addPredicate(mid, ACCEPT, Predicate.endOfInput());

    assertThat(nfa.removePredicates(), is(1));
    assertThat(nfa.isEoiAccepting(nfa.numStates() - 1), is(true));

    Dfa dfa = nfa.determinize();
    assertThat(accepts(dfa, "a"), is(true));
    assertThat(accepts(dfa, "ba"), is(true));
    assertThat(accepts(dfa, "ab"), is(false));
    assertThat(accepts(dfa, ""), is(false));
  }

  @Test
  public void testAdjacentPredicatesNeedSecondPass() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    nfa.addPredicate(ENTRY, mid, Predicate.beginningOfInput());
    nfa.addPredicate(mid, ACCEPT, Predicate.endOfInput());

    assertThat(nfa.removePredicates(), is(2));
    assertThat(nfa.numPredicates(), is(0));

    Dfa dfa = nfa.determinize();
    assertThat(accepts(dfa, ""), is(true));
    assertThat(accepts(dfa, "a"), is(false));
  }

  @Test
  public void testWordBoundary() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    for (Predicate p : Predicate.wordBoundary()) {
      nfa.addPredicate(ENTRY, mid, p);
    }
    nfa.addTransition(mid, ACCEPT, CharRange.single('a'));

    assertThat(nfa.removePredicates(), is(1));

    Dfa dfa = nfa.determinize();
    assertThat(accepts(dfa, "a"), is(true));
    assertThat(accepts(dfa, "-a"), is(true));
    assertThat(accepts(dfa, "ba"), is(false));
    assertThat(accepts(dfa, "b"), is(false));
  }

  @Test
  public void testBeginningOfLine() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    nfa.addPredicate(ENTRY, mid, Predicate.beginningOfLine());
    nfa.addTransition(mid, ACCEPT, CharRange.single('a'));
    nfa.removePredicates();

    Dfa dfa = nfa.determinize();
    assertThat(accepts(dfa, "a"), is(true));
    assertThat(accepts(dfa, "b\na"), is(true));
    assertThat(accepts(dfa, "ba"), is(false));
  }

  @Test
  public void testTooComplex() {
    Nfa nfa = unanchored();
    nfa.addPredicate(ENTRY, ACCEPT, Predicate.endOfInput());
    try {
      nfa.removePredicates(3);
      throw new AssertionError("expected TooComplexToDeterminizeException");
    } catch (TooComplexToDeterminizeException e) {
      assertThat(e.getMaxStates(), is(3));
    }
  }

  @Test
  public void testDuplicatePredicateIsIgnored() {
    Nfa nfa = unanchored();
    nfa.addPredicate(ENTRY, ACCEPT, Predicate.endOfInput());
    nfa.addPredicate(ENTRY, ACCEPT, Predicate.endOfInput());
    assertThat(nfa.numPredicates(), is(1));
    assertThat(nfa.predicatesFrom(ENTRY).size(), is(1));
  }

  @Test
  public void testTooManyPredicateEdges() {
    Nfa nfa = unanchored();
    int mid = nfa.addState(false);
    nfa.addPredicate(ENTRY, mid, Predicate.beginningOfLine());
    nfa.addPredicate(mid, ACCEPT, Predicate.beginningOfInput());
    nfa.addPredicate(mid, ACCEPT, Predicate.endOfInput());
    nfa.addPredicate(mid, ACCEPT, Predicate.beginningOfLine());
    nfa.addPredicate(mid, ACCEPT, Predicate.endOfLine());
    nfa.addPredicate(mid, mid, Predicate.endOfInput());
    nfa.addPredicate(mid, mid, Predicate.endOfLine());
    assertThat(nfa.numPredicates(), is(7));
    try {
      // six edges are still waiting after the first one goes, with only five states
      nfa.removePredicates(5);
      throw new AssertionError("expected TooComplexToDeterminizeException");
    } catch (TooComplexToDeterminizeException e) {
      assertThat(e.getMaxStates(), is(5));
      assertThat(nfa.numStates(), is(5));
    }
  }

  private static Nfa unanchored() {
    Nfa nfa = new Nfa();
    nfa.addState(false);
    nfa.addTransition(0, 0, CharRange.full());
    nfa.addState(false);
    nfa.addEps(0, ENTRY);
    nfa.addState(true);
    nfa.addTransition(ACCEPT, ACCEPT, CharRange.full());
    return nfa;
  }
}
