package org.trypticon.regexdfa.automaton;

/**
 * Runs a {@link Dfa} over a whole input, for checking which inputs it accepts.
 */
public final class DfaRunner {
  private DfaRunner() {
  }

  /**
   * Tests whether the automaton accepts the input, starting at the start of the input.
   *
   * @param dfa the automaton.
   * @param input the input.
   * @return {@code true} if the run ends in a state that accepts at end of input.
   */
  public static boolean accepts(Dfa dfa, String input) {
    if (dfa.numStates() == 0) {
      return false;
    }
    int state = dfa.getInitialState(true);
    for (int ch : input.codePoints().toArray()) {
      state = dfa.step(state, ch);
      if (state < 0) {
        return false;
      }
    }
    return dfa.isAcceptAtEoi(state);
  }
}
