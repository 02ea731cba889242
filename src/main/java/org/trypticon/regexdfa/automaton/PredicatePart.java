package org.trypticon.regexdfa.automaton;

import org.trypticon.regexdfa.charmap.CharSet;

/**
 * One side of a {@link Predicate}: a condition on the character next to a zero-width
 * position.
 * <p>
 * The condition holds if the neighbouring character is in {@link #chars}, or if there
 * is no neighbouring character (the position is at the edge of the input) and
 * {@link #atBoundary} is set.
 */
public final class PredicatePart {

  public final CharSet chars;
  public final boolean atBoundary;

  public PredicatePart(CharSet chars, boolean atBoundary) {
    this.chars = chars;
    this.atBoundary = atBoundary;
  }

  /** Condition that nothing can satisfy except the edge of the input. */
  public static PredicatePart boundaryOnly() {
    return new PredicatePart(new CharSet(), true);
  }

  /** Condition that always holds. */
  public static PredicatePart anything() {
    return new PredicatePart(CharSet.full(), true);
  }

  /** Tests whether no position can satisfy this condition. */
  public boolean isUnsatisfiable() {
    return chars.isEmpty() && !atBoundary;
  }

  public PredicatePart intersect(PredicatePart other) {
    return new PredicatePart(chars.intersect(other.chars), atBoundary && other.atBoundary);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof PredicatePart)) {
      return false;
    }
    PredicatePart that = (PredicatePart) other;
    return atBoundary == that.atBoundary && chars.equals(that.chars);
  }

  @Override
  public int hashCode() {
    return chars.hashCode() * 2 + (atBoundary ? 1 : 0);
  }

  @Override
  public String toString() {
    return chars + (atBoundary ? "|^$" : "");
  }
}
