/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.regexdfa.automaton;

import java.util.ArrayList;
import java.util.List;

import org.trypticon.regexdfa.charmap.CharMap;
import org.trypticon.regexdfa.charmap.CharRange;

/**
 * A deterministic automaton over code points.
 * <p>
 * States are added with {@link #addState} and numbered from 0. Transitions may be added
 * in any order; {@link #sortTransitions()} must be called once they are all in, after
 * which {@link #step} can be used.
 * <p>
 * Matching may begin at state 0 anywhere in the input, or at
 * {@link #getInitialState(boolean) getInitialState(true)} at the very start of it.
 */
public class Dfa {

  private final List<CharMap<Integer>> transitions = new ArrayList<>();
  private final List<Boolean> accept = new ArrayList<>();
  private final List<Boolean> acceptAtEoi = new ArrayList<>();
  private int initialAtStart;

  public Dfa() {
  }

  /**
   * Appends a state.
   *
   * @return the index of the new state.
   */
  public int addState(boolean accepting) {
    transitions.add(new CharMap<>());
    accept.add(accepting);
    acceptAtEoi.add(accepting);
    return transitions.size() - 1;
  }

  public int numStates() {
    return transitions.size();
  }

  public int getNumTransitions() {
    int count = 0;
    for (CharMap<Integer> t : transitions) {
      count += t.size();
    }
    return count;
  }

  public boolean isAccept(int state) {
    return accept.get(state);
  }

  /**
   * Marks a state as accepting if the input ends there.
   */
  public void setAcceptAtEoi(int state) {
    checkState("state", state);
    acceptAtEoi.set(state, true);
  }

  /** Tests whether a match ends in this state when no input follows. */
  public boolean isAcceptAtEoi(int state) {
    return acceptAtEoi.get(state);
  }

  public void setInitialAtStart(int state) {
    checkState("state", state);
    initialAtStart = state;
  }

  /**
   * Returns the state to start matching from.
   *
   * @param atStart whether matching begins at the very start of the input.
   */
  public int getInitialState(boolean atStart) {
    return atStart ? initialAtStart : 0;
  }

  public void addTransition(int source, int dest, CharRange range) {
    checkState("source", source);
    checkState("dest", dest);
    transitions.get(source).push(range, dest);
  }

  /**
   * Sorts the transitions out of every state by range.
   *
   * @throws IllegalStateException if two transitions out of a state overlap.
   */
  public void sortTransitions() {
    for (CharMap<Integer> t : transitions) {
      t.sort();
    }
  }

  /** The transitions out of {@code state}, as a read-only list in range order. */
  public List<CharMap.Entry<Integer>> transitionsFrom(int state) {
    return transitions.get(state).entries();
  }

  /**
   * Follows the transition out of {@code state} on {@code ch}.
   *
   * @return the destination state, or -1 if there is none.
   */
  public int step(int state, int ch) {
    Integer dest = transitions.get(state).get(ch);
    return dest == null ? -1 : dest;
  }

  private void checkState(String name, int state) {
    if (state < 0 || state >= numStates()) {
      throw new IllegalArgumentException(name + "=" + state + " is out of bounds (numStates=" + numStates() + ")");
    }
  }

  static void appendCharString(int c, StringBuilder b) {
    if (c >= 0x21 && c <= 0x7e && c != '\\' && c != '"') b.appendCodePoint(c);
    else {
      b.append("\\\\U");
      String s = Integer.toHexString(c);
      if (c < 0x10) b.append("0000000").append(s);
      else if (c < 0x100) b.append("000000").append(s);
      else if (c < 0x1000) b.append("00000").append(s);
      else if (c < 0x10000) b.append("0000").append(s);
      else if (c < 0x100000) b.append("000").append(s);
      else b.append("00").append(s);
    }
  }

  /** Renders the automaton in Graphviz dot format. */
  public String toDot() {
    StringBuilder b = new StringBuilder();
    b.append("digraph Dfa {\n");
    b.append("  rankdir = LR\n");
    final int numStates = numStates();
    if (numStates > 0) {
      b.append("  initial [shape=plaintext,label=\"0\"]\n");
      b.append("  initial -> 0\n");
      if (initialAtStart != 0) {
        b.append("  initial_at_start [shape=plaintext,label=\"^\"]\n");
        b.append("  initial_at_start -> ").append(initialAtStart).append('\n');
      }
    }

    for (int state = 0; state < numStates; state++) {
      b.append("  ");
      b.append(state);
      if (isAccept(state)) {
        b.append(" [shape=doublecircle,label=\"").append(state).append("\"]\n");
      } else if (isAcceptAtEoi(state)) {
        b.append(" [shape=doublecircle,style=dashed,label=\"").append(state).append("\"]\n");
      } else {
        b.append(" [shape=circle,label=\"").append(state).append("\"]\n");
      }
      for (CharMap.Entry<Integer> t : transitions.get(state)) {
        b.append("  ");
        b.append(state);
        b.append(" -> ");
        b.append(t.value);
        b.append(" [label=\"");
        appendCharString(t.range.start, b);
        if (t.range.end != t.range.start) {
          b.append('-');
          appendCharString(t.range.end, b);
        }
        b.append("\"]\n");
      }
    }
    b.append('}');
    return b.toString();
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append("Dfa (").append(numStates()).append(" states):\n");
    for (int state = 0; state < numStates(); state++) {
      b.append("\tState ").append(state)
          .append(" (accepting: ").append(isAccept(state))
          .append(", at eoi: ").append(isAcceptAtEoi(state)).append("):\n");
      for (CharMap.Entry<Integer> t : transitions.get(state)) {
        b.append("\t\t").append(t.range.start).append(" -- ").append(t.range.end)
            .append(" => ").append(t.value).append('\n');
      }
    }
    return b.toString();
  }
}
