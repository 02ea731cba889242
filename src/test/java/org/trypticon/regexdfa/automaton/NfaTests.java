package org.trypticon.regexdfa.automaton;

import java.util.BitSet;

import org.junit.Test;
import org.trypticon.regexdfa.charmap.CharMap;
import org.trypticon.regexdfa.charmap.CharRange;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link Nfa} construction, closures and determinization.
 */
public class NfaTests {

  @Test
  public void testAddState() {
    Nfa nfa = new Nfa();
    assertThat(nfa.addState(false), is(0));
    assertThat(nfa.addState(true), is(1));
    assertThat(nfa.numStates(), is(2));
    assertThat(nfa.isAccepting(0), is(false));
    assertThat(nfa.isAccepting(1), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddTransitionOutOfBounds() {
    Nfa nfa = new Nfa();
    nfa.addState(false);
    nfa.addTransition(0, 1, CharRange.single('a'));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddEpsOutOfBounds() {
    Nfa nfa = new Nfa();
    nfa.addState(false);
    nfa.addEps(-1, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddPredicateOutOfBounds() {
    new Nfa().addPredicate(0, 0, Predicate.beginningOfInput());
  }

  @Test
  public void testEpsClosure() {
    Nfa nfa = states(5);
    nfa.addEps(0, 1);
    nfa.addEps(1, 2);
    nfa.addEps(2, 0);
    nfa.addEps(3, 4);

    assertThat(nfa.epsClosure(0), is(bits(0, 1, 2)));
    assertThat(nfa.epsClosure(3), is(bits(3, 4)));
    assertThat(nfa.epsClosure(4), is(bits(4)));
    assertThat(nfa.epsClosure(bits(2, 3)), is(bits(0, 1, 2, 3, 4)));
  }

  @Test
  public void testTransitionsGroupsAndCloses() {
    Nfa nfa = states(4);
    nfa.addTransition(0, 1, new CharRange('a', 'c'));
    nfa.addTransition(0, 2, new CharRange('b', 'd'));
    nfa.addEps(2, 3);

    assertThat(nfa.transitions(bits(0)), contains(
        new CharMap.Entry<>(CharRange.single('a'), bits(1)),
        new CharMap.Entry<>(new CharRange('b', 'c'), bits(1, 2, 3)),
        new CharMap.Entry<>(CharRange.single('d'), bits(2, 3))));
  }

  @Test
  public void testReversed() {
    Nfa nfa = states(3);
    nfa.addTransition(0, 1, CharRange.single('a'));
    nfa.addEps(1, 2);
    nfa.addPredicate(0, 2, Predicate.endOfInput());

    Nfa reversed = nfa.reversed();
    assertThat(reversed.numStates(), is(3));
    assertThat(reversed.transitionsFrom(0).isEmpty(), is(true));
    assertThat(reversed.transitionsFrom(1), contains(new CharMap.Entry<>(CharRange.single('a'), 0)));
    assertThat(reversed.epsFrom(2), contains(1));
    // reversed predicate edges lead back to the original source
    assertThat(reversed.predicatesFrom(2),
        contains(new NfaState.PredicateTransition(Predicate.endOfInput(), 0)));
    assertThat(reversed.predicatesFrom(0).isEmpty(), is(true));
  }

  @Test
  public void testEdgeViewsAreReadOnly() {
    Nfa nfa = states(2);
    nfa.addTransition(0, 1, CharRange.single('a'));
    nfa.addPredicate(0, 1, Predicate.endOfInput());
    try {
      nfa.transitionsFrom(0).add(new CharMap.Entry<>(CharRange.single('b'), 1));
      throw new AssertionError("expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) {
      assertThat(nfa.transitionsFrom(0).size(), is(1));
    }
    try {
      nfa.predicatesFrom(0).clear();
      throw new AssertionError("expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) {
      assertThat(nfa.numPredicates(), is(1));
    }
  }

  @Test
  public void testDeterminizeOverlappingRanges() {
    Nfa nfa = new Nfa();
    nfa.addState(false);
    nfa.addState(false);
    nfa.addState(true);
    nfa.addTransition(0, 1, new CharRange('a', 'c'));
    nfa.addTransition(0, 2, new CharRange('b', 'd'));

    Dfa dfa = nfa.determinize();
    assertThat(dfa.numStates(), is(4));
    int a = dfa.step(0, 'a');
    int b = dfa.step(0, 'b');
    int d = dfa.step(0, 'd');
    assertThat(dfa.step(0, 'c'), is(b));
    assertThat(dfa.step(0, 'e'), is(-1));
    assertThat(dfa.isAccept(a), is(false));
    assertThat(dfa.isAccept(b), is(true));
    assertThat(dfa.isAccept(d), is(true));
    assertThat(dfa.isAccept(0), is(false));
  }

  @Test
  public void testDeterminizeSharesStateSets() {
    // ac|bc: both branches reach state 3 on 'c'
    Nfa nfa = states(3);
    nfa.addState(true);
    nfa.addTransition(0, 1, CharRange.single('a'));
    nfa.addTransition(0, 2, CharRange.single('b'));
    nfa.addTransition(1, 3, CharRange.single('c'));
    nfa.addTransition(2, 3, CharRange.single('c'));

    Dfa dfa = nfa.determinize();
    assertThat(dfa.numStates(), is(4));
    int afterA = dfa.step(0, 'a');
    int afterB = dfa.step(0, 'b');
    assertThat(afterA == afterB, is(false));
    assertThat(dfa.step(afterA, 'c'), is(dfa.step(afterB, 'c')));
    assertThat(dfa.isAccept(dfa.step(afterA, 'c')), is(true));
  }

  @Test
  public void testDeterminizeTransitionsAreSorted() {
    Nfa nfa = states(3);
    nfa.addTransition(0, 1, new CharRange('x', 'z'));
    nfa.addTransition(0, 2, new CharRange('a', 'c'));
    nfa.addTransition(0, 1, new CharRange('m', 'm'));

    Dfa dfa = nfa.determinize();
    for (int s = 0; s < dfa.numStates(); s++) {
      int lastEnd = -1;
      for (CharMap.Entry<Integer> t : dfa.transitionsFrom(s)) {
        assertThat(t.range.start > lastEnd, is(true));
        lastEnd = t.range.end;
      }
    }
  }

  @Test
  public void testDeterminizeEmpty() {
    assertThat(new Nfa().determinize().numStates(), is(0));
  }

  @Test(expected = IllegalStateException.class)
  public void testDeterminizeWithPredicates() {
    Nfa nfa = states(2);
    nfa.addPredicate(0, 1, Predicate.beginningOfInput());
    nfa.determinize();
  }

  @Test
  public void testDeterminizeTooComplex() {
    Nfa nfa = states(2);
    nfa.addTransition(0, 1, CharRange.single('a'));
    try {
      nfa.determinize(1);
      throw new AssertionError("expected TooComplexToDeterminizeException");
    } catch (TooComplexToDeterminizeException e) {
      assertThat(e.getMaxStates(), is(1));
      assertThat(e.getNfa() == nfa, is(true));
    }
  }

  @Test
  public void testToString() {
    Nfa nfa = states(2);
    nfa.addTransition(0, 1, new CharRange(97, 98));
    nfa.addEps(1, 0);
    String dump = nfa.toString();
    assertThat(dump, containsString("Nfa (2 states):\n"));
    assertThat(dump, containsString("\tState 0 (accepting: false):\n\t\tTransitions:\n\t\t\t97 -- 98 => 1\n"));
    assertThat(dump, containsString("\t\tEps-transitions: [0]\n"));
  }

  private static Nfa states(int count) {
    Nfa nfa = new Nfa();
    for (int i = 0; i < count; i++) {
      nfa.addState(false);
    }
    return nfa;
  }

  static BitSet bits(int... values) {
    BitSet set = new BitSet();
    for (int v : values) {
      set.set(v);
    }
    return set;
  }
}
