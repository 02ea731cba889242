package org.trypticon.regexdfa.automaton;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.trypticon.regexdfa.charmap.CharMultiMap;

/**
 * A single state of an {@link Nfa} and its outgoing edges. Edges name their target by
 * state index.
 */
final class NfaState {

  /** Consuming edges: range to target state. */
  final CharMultiMap<Integer> ranges = new CharMultiMap<>();

  /** Epsilon edges. */
  final List<Integer> eps = new ArrayList<>();

  /** Zero-width edges, in insertion order and without repeats. */
  final Set<PredicateTransition> predicates = new LinkedHashSet<>();

  final boolean accepting;

  NfaState(boolean accepting) {
    this.accepting = accepting;
  }

  /**
   * A predicate edge. In a reversed automaton {@link #target} is the original source.
   */
  static final class PredicateTransition {
    final Predicate predicate;
    final int target;

    PredicateTransition(Predicate predicate, int target) {
      this.predicate = predicate;
      this.target = target;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof PredicateTransition)) {
        return false;
      }
      PredicateTransition that = (PredicateTransition) other;
      return target == that.target && predicate.equals(that.predicate);
    }

    @Override
    public int hashCode() {
      return 31 * predicate.hashCode() + target;
    }

    @Override
    public String toString() {
      return predicate + " => " + target;
    }
  }
}
