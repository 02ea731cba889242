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

/**
 * Thrown when removing predicates from, or determinizing, an {@link Nfa} would need more
 * states than the caller allowed.
 */
public class TooComplexToDeterminizeException extends RuntimeException {
  private transient final Nfa nfa;
  private transient final String pattern;
  private transient final int maxStates;

  public TooComplexToDeterminizeException(String pattern, TooComplexToDeterminizeException cause) {
    super("Determinizing " + pattern + " would require more than " + cause.maxStates + " states.", cause);
    this.pattern = pattern;
    this.nfa = cause.nfa;
    this.maxStates = cause.maxStates;
  }

  public TooComplexToDeterminizeException(Nfa nfa, int maxStates) {
    super("Determinizing automaton with " + nfa.numStates() + " states and " + nfa.numPredicates() + " predicates would require more than " + maxStates + " states.");
    this.nfa = nfa;
    this.pattern = null;
    this.maxStates = maxStates;
  }

  public Nfa getNfa() {
    return nfa;
  }

  /** The pattern being compiled, or {@code null} if the automaton was not built from one. */
  public String getPattern() {
    return pattern;
  }

  public int getMaxStates() {
    return maxStates;
  }
}
