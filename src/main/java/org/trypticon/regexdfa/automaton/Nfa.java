package org.trypticon.regexdfa.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.trypticon.regexdfa.automaton.NfaState.PredicateTransition;
import org.trypticon.regexdfa.charmap.CharMap;
import org.trypticon.regexdfa.charmap.CharMultiMap;
import org.trypticon.regexdfa.charmap.CharRange;

/**
 * A non-deterministic automaton over code points, with consuming, epsilon and
 * zero-width {@link Predicate} edges.
 * <p>
 * There is no support for running an {@code Nfa} directly: it is built up with
 * {@link #addState} and the edge methods, then turned into a {@link Dfa} with
 * {@link #removePredicates()} followed by {@link #determinize()}.
 * <p>
 * State 0 is always the start state. The automaton is unanchored: a match may begin
 * anywhere in the input. States in {@link #isAnchored anchored} are additional start
 * states, valid only when matching begins at the very start of the input. States that are
 * {@link #isEoiAccepting end-of-input accepting} accept only when the input ends there.
 * Both kinds are created when predicates are removed.
 */
public class Nfa {

  /** Default limit on the number of states {@link #determinize()} may create. */
  public static final int DEFAULT_MAX_DETERMINIZED_STATES = 10000;

  /** Default limit on the number of states {@link #removePredicates()} may grow to. */
  public static final int DEFAULT_MAX_STATES = 10000;

  private final List<NfaState> states;
  private final BitSet anchoredStates = new BitSet();
  private final BitSet eoiAcceptingStates = new BitSet();

  public Nfa() {
    states = new ArrayList<>();
  }

  public Nfa(int numStates) {
    states = new ArrayList<>(numStates);
  }

  /**
   * Appends a state.
   *
   * @return the index of the new state.
   */
  public int addState(boolean accepting) {
    states.add(new NfaState(accepting));
    return states.size() - 1;
  }

  public int numStates() {
    return states.size();
  }

  /** Total number of predicate edges. */
  public int numPredicates() {
    int count = 0;
    for (NfaState state : states) {
      count += state.predicates.size();
    }
    return count;
  }

  public void addTransition(int source, int dest, CharRange range) {
    checkState("source", source);
    checkState("dest", dest);
    states.get(source).ranges.push(range, dest);
  }

  public void addEps(int source, int dest) {
    checkState("source", source);
    checkState("dest", dest);
    states.get(source).eps.add(dest);
  }

  /** Adds a predicate edge. Adding an edge that is already there has no effect. */
  public void addPredicate(int source, int dest, Predicate predicate) {
    checkState("source", source);
    checkState("dest", dest);
    states.get(source).predicates.add(new PredicateTransition(predicate, dest));
  }

  private void checkState(String name, int state) {
    if (state < 0 || state >= states.size()) {
      throw new IllegalArgumentException(name + "=" + state + " is out of bounds (numStates=" + states.size() + ")");
    }
  }

  public boolean isAccepting(int state) {
    return states.get(state).accepting;
  }

  public boolean isAnchored(int state) {
    return anchoredStates.get(state);
  }

  public void setAnchored(int state) {
    checkState("state", state);
    anchoredStates.set(state);
  }

  public boolean isEoiAccepting(int state) {
    return eoiAcceptingStates.get(state);
  }

  /** The consuming edges out of {@code state}, as a read-only list. */
  public List<CharMap.Entry<Integer>> transitionsFrom(int state) {
    return states.get(state).ranges.entries();
  }

  public List<Integer> epsFrom(int state) {
    return Collections.unmodifiableList(states.get(state).eps);
  }

  Set<PredicateTransition> predicatesFrom(int state) {
    return Collections.unmodifiableSet(states.get(state).predicates);
  }

  /** Returns the set of states reachable from {@code states} by epsilon edges alone. */
  public BitSet epsClosure(BitSet states) {
    BitSet ret = (BitSet) states.clone();
    Deque<Integer> pending = new ArrayDeque<>();
    for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
      pending.push(s);
    }
    while (!pending.isEmpty()) {
      int s = pending.pop();
      for (int t : this.states.get(s).eps) {
        if (!ret.get(t)) {
          ret.set(t);
          pending.push(t);
        }
      }
    }
    return ret;
  }

  public BitSet epsClosure(int state) {
    BitSet set = new BitSet(states.size());
    set.set(state);
    return epsClosure(set);
  }

  /**
   * Finds the consuming transitions out of a set of states, which should already be
   * epsilon-closed. The result maps disjoint ranges to the epsilon-closed set of states
   * reached on them.
   */
  public CharMap<BitSet> transitions(BitSet from) {
    CharMultiMap<Integer> all = new CharMultiMap<>();
    for (int s = from.nextSetBit(0); s >= 0; s = from.nextSetBit(s + 1)) {
      all.addAll(states.get(s).ranges);
    }
    CharMap<BitSet> ret = CharMultiMap.group(all);
    ret.mapValues(this::epsClosure);
    return ret;
  }

  /** Finds the predicate edges out of a set of states. */
  List<PredicateTransition> predicates(BitSet from) {
    List<PredicateTransition> ret = new ArrayList<>();
    for (int s = from.nextSetBit(0); s >= 0; s = from.nextSetBit(s + 1)) {
      ret.addAll(states.get(s).predicates);
    }
    return ret;
  }

  private boolean anyAccepting(BitSet set) {
    for (int s = set.nextSetBit(0); s >= 0; s = set.nextSetBit(s + 1)) {
      if (states.get(s).accepting) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a copy with every edge reversed. States keep their indices and accepting
   * flags. A reversed predicate edge names the source of the original edge.
   */
  Nfa reversed() {
    Nfa ret = new Nfa(states.size());
    for (NfaState state : states) {
      ret.addState(state.accepting);
    }

    for (int idx = 0; idx < states.size(); idx++) {
      NfaState state = states.get(idx);
      for (CharMap.Entry<Integer> t : state.ranges) {
        ret.states.get(t.value).ranges.push(t.range, idx);
      }
      for (int target : state.eps) {
        ret.states.get(target).eps.add(idx);
      }
      for (PredicateTransition p : state.predicates) {
        ret.states.get(p.target).predicates.add(new PredicateTransition(p.predicate, idx));
      }
    }
    return ret;
  }

  /**
   * Removes all predicate edges, growing the automaton to at most
   * {@link #DEFAULT_MAX_STATES} states.
   *
   * @see #removePredicates(int)
   */
  public int removePredicates() {
    return removePredicates(DEFAULT_MAX_STATES);
  }

  /**
   * Rewrites this automaton so that it has no predicate edges but accepts the same
   * language.
   * <p>
   * Each pass replaces every predicate edge {@code a -> b} with a new state that copies the
   * filtered transitions into {@code a} and out of {@code b}. Predicates met on either side
   * are intersected with the one being removed and left for the next pass. Passes repeat
   * until one of them creates no state.
   *
   * @param maxStates the most states the automaton may grow to. The number of predicate
   *        edges alive at any one time is held to the same limit.
   * @return the number of passes that changed the automaton; 0 if there were no predicates.
   * @throws TooComplexToDeterminizeException if the automaton would need more than
   *         {@code maxStates} states or predicate edges.
   */
  public int removePredicates(int maxStates) {
    int passes = 0;
    while (removePredicatesOnce(maxStates)) {
      passes++;
    }
    return passes;
  }

  /**
   * Runs a single elimination pass.
   *
   * @return whether any state was created.
   */
  boolean removePredicatesOnce(int maxStates) {
    final int origLen = states.size();
    Nfa reversed = reversed();
    int numPredicates = numPredicates();

    for (int idx = 0; idx < origLen; idx++) {
      List<PredicateTransition> preds = new ArrayList<>(states.get(idx).predicates);
      states.get(idx).predicates.clear();
      numPredicates -= preds.size();
      for (PredicateTransition p : preds) {
        boolean removed = reversed.states.get(p.target).predicates.remove(new PredicateTransition(p.predicate, idx));
        assert removed : "reversed copy has no edge for " + p;
      }

      for (PredicateTransition p : preds) {
        if (states.size() >= maxStates) {
          throw new TooComplexToDeterminizeException(this, maxStates);
        }
        final Predicate pred = p.predicate;
        final int newIdx = addState(false);
        reversed.addState(false);
        assert reversed.numStates() == numStates();

        BitSet inStates = reversed.epsClosure(idx);
        BitSet outStates = epsClosure(p.target);
        CharMap<BitSet> inTrans = pred.filterIncoming(reversed.transitions(inStates));
        CharMap<BitSet> outTrans = pred.filterOutgoing(transitions(outStates));

        for (CharMap.Entry<BitSet> t : inTrans) {
          for (int source = t.value.nextSetBit(0); source >= 0; source = t.value.nextSetBit(source + 1)) {
            addTransition(source, newIdx, t.range);
            reversed.addTransition(newIdx, source, t.range);
          }
        }
        for (PredicateTransition other : reversed.predicates(inStates)) {
          Predicate both = pred.intersect(other.predicate);
          if (both != null && addPredicate(reversed, other.target, newIdx, both)) {
            numPredicates++;
          }
        }
        for (CharMap.Entry<BitSet> t : outTrans) {
          for (int target = t.value.nextSetBit(0); target >= 0; target = t.value.nextSetBit(target + 1)) {
            addTransition(newIdx, target, t.range);
            reversed.addTransition(target, newIdx, t.range);
          }
        }
        for (PredicateTransition other : predicates(outStates)) {
          Predicate both = pred.intersect(other.predicate);
          if (both != null && addPredicate(reversed, newIdx, other.target, both)) {
            numPredicates++;
          }
        }
        if (numPredicates > maxStates) {
          throw new TooComplexToDeterminizeException(this, maxStates);
        }

        // reachable with nothing before it, or accepting with nothing after it
        if (pred.before.atBoundary && (inStates.get(0) || inStates.intersects(anchoredStates))) {
          anchoredStates.set(newIdx);
        }
        if (pred.after.atBoundary && (anyAccepting(outStates) || outStates.intersects(eoiAcceptingStates))) {
          eoiAcceptingStates.set(newIdx);
        }
      }
    }

    return states.size() > origLen;
  }

  /**
   * Adds a predicate edge here and its mirror image to {@code reversed}.
   *
   * @return {@code false} if the edge was already there.
   */
  private boolean addPredicate(Nfa reversed, int source, int dest, Predicate predicate) {
    if (!states.get(source).predicates.add(new PredicateTransition(predicate, dest))) {
      return false;
    }
    reversed.states.get(dest).predicates.add(new PredicateTransition(predicate, source));
    return true;
  }

  /**
   * Determinizes with a limit of {@link #DEFAULT_MAX_DETERMINIZED_STATES} states.
   *
   * @see #determinize(int)
   */
  public Dfa determinize() {
    return determinize(DEFAULT_MAX_DETERMINIZED_STATES);
  }

  /**
   * Creates a deterministic automaton accepting the same language, by subset
   * construction. Predicates must have been removed first.
   *
   * @param maxDeterminizedStates the most states the result may have.
   * @throws IllegalStateException if there are predicate edges.
   * @throws TooComplexToDeterminizeException if the result would need more than
   *         {@code maxDeterminizedStates} states.
   */
  public Dfa determinize(int maxDeterminizedStates) {
    Dfa ret = new Dfa();
    if (states.isEmpty()) {
      return ret;
    }
    if (numPredicates() > 0) {
      throw new IllegalStateException("predicates must be removed before determinizing");
    }

    Map<BitSet, Integer> stateMap = new HashMap<>();
    Deque<BitSet> worklist = new ArrayDeque<>();
    lookupOrAdd(epsClosure(0), ret, stateMap, worklist, maxDeterminizedStates);

    if (!anchoredStates.isEmpty()) {
      BitSet atStart = (BitSet) anchoredStates.clone();
      atStart.set(0);
      ret.setInitialAtStart(lookupOrAdd(epsClosure(atStart), ret, stateMap, worklist, maxDeterminizedStates));
    }

    while (!worklist.isEmpty()) {
      BitSet set = worklist.pop();
      int idx = stateMap.get(set);
      for (CharMap.Entry<BitSet> t : transitions(set)) {
        int target = lookupOrAdd(t.value, ret, stateMap, worklist, maxDeterminizedStates);
        ret.addTransition(idx, target, t.range);
      }
    }

    ret.sortTransitions();
    return ret;
  }

  private int lookupOrAdd(BitSet set, Dfa dfa, Map<BitSet, Integer> stateMap, Deque<BitSet> worklist,
                          int maxDeterminizedStates) {
    Integer idx = stateMap.get(set);
    if (idx != null) {
      return idx;
    }
    if (dfa.numStates() >= maxDeterminizedStates) {
      throw new TooComplexToDeterminizeException(this, maxDeterminizedStates);
    }
    boolean accept = anyAccepting(set);
    int newIdx = dfa.addState(accept);
    if (!accept && set.intersects(eoiAcceptingStates)) {
      dfa.setAcceptAtEoi(newIdx);
    }
    stateMap.put(set, newIdx);
    worklist.push(set);
    return newIdx;
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append("Nfa (").append(states.size()).append(" states):\n");
    for (int idx = 0; idx < states.size(); idx++) {
      NfaState state = states.get(idx);
      b.append("\tState ").append(idx).append(" (accepting: ").append(state.accepting);
      if (anchoredStates.get(idx)) {
        b.append(", anchored");
      }
      if (eoiAcceptingStates.get(idx)) {
        b.append(", accepting at eoi");
      }
      b.append("):\n");

      if (!state.ranges.isEmpty()) {
        b.append("\t\tTransitions:\n");
        for (CharMap.Entry<Integer> t : state.ranges) {
          b.append("\t\t\t").append(t.range.start).append(" -- ").append(t.range.end)
              .append(" => ").append(t.value).append('\n');
        }
      }
      if (!state.eps.isEmpty()) {
        b.append("\t\tEps-transitions: ").append(state.eps).append('\n');
      }
      if (!state.predicates.isEmpty()) {
        b.append("\t\tPredicates: ").append(state.predicates).append('\n');
      }
    }
    return b.toString();
  }
}
