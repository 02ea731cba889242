package org.trypticon.regexdfa.automaton;

import java.util.Arrays;
import java.util.BitSet;

import org.trypticon.regexdfa.charmap.CharMap;
import org.trypticon.regexdfa.charmap.CharRange;
import org.trypticon.regexdfa.charmap.CharSet;

/**
 * A zero-width condition on an {@link Nfa} edge, such as "start of input" or "word
 * boundary". It consumes no input but restricts the characters on either side of the
 * position where it is crossed.
 */
public final class Predicate {

  private static final CharSet WORD_CHARS = wordChars();

  private static final CharSet NEWLINE = CharSet.single('\n');

  /** Condition on the character before the position. */
  public final PredicatePart before;

  /** Condition on the character after the position. */
  public final PredicatePart after;

  public Predicate(PredicatePart before, PredicatePart after) {
    this.before = before;
    this.after = after;
  }

  public static Predicate beginningOfInput() {
    return new Predicate(PredicatePart.boundaryOnly(), PredicatePart.anything());
  }

  public static Predicate endOfInput() {
    return new Predicate(PredicatePart.anything(), PredicatePart.boundaryOnly());
  }

  public static Predicate beginningOfLine() {
    return new Predicate(new PredicatePart(NEWLINE, true), PredicatePart.anything());
  }

  public static Predicate endOfLine() {
    return new Predicate(PredicatePart.anything(), new PredicatePart(NEWLINE, true));
  }

  /**
   * A word boundary is a union of two conditions (word then non-word, or non-word then
   * word), so it needs two parallel edges.
   */
  public static Predicate[] wordBoundary() {
    PredicatePart word = new PredicatePart(WORD_CHARS, false);
    PredicatePart notWord = new PredicatePart(WORD_CHARS.negated(), true);
    return new Predicate[] {
        new Predicate(word, notWord),
        new Predicate(notWord, word),
    };
  }

  public static Predicate[] notWordBoundary() {
    PredicatePart word = new PredicatePart(WORD_CHARS, false);
    PredicatePart notWord = new PredicatePart(WORD_CHARS.negated(), true);
    return new Predicate[] {
        new Predicate(word, word),
        new Predicate(notWord, notWord),
    };
  }

  /** The word characters used by {@link #wordBoundary()}: {@code [0-9A-Z_a-z]}. */
  public static CharSet wordChars() {
    return CharSet.fromRanges(Arrays.asList(
        new CharRange('0', '9'),
        new CharRange('A', 'Z'),
        CharRange.single('_'),
        new CharRange('a', 'z')));
  }

  /**
   * Keeps only the transitions into the predicate's position whose character satisfies
   * {@link #before}.
   */
  public CharMap<BitSet> filterIncoming(CharMap<BitSet> in) {
    return in.intersect(before.chars);
  }

  /**
   * Keeps only the transitions out of the predicate's position whose character satisfies
   * {@link #after}.
   */
  public CharMap<BitSet> filterOutgoing(CharMap<BitSet> out) {
    return out.intersect(after.chars);
  }

  /**
   * Returns the predicate satisfied exactly where both {@code this} and {@code other}
   * are, or {@code null} if no position can satisfy both.
   */
  public Predicate intersect(Predicate other) {
    PredicatePart b = before.intersect(other.before);
    PredicatePart a = after.intersect(other.after);
    if (b.isUnsatisfiable() || a.isUnsatisfiable()) {
      return null;
    }
    return new Predicate(b, a);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Predicate)) {
      return false;
    }
    Predicate that = (Predicate) other;
    return before.equals(that.before) && after.equals(that.after);
  }

  @Override
  public int hashCode() {
    return 31 * before.hashCode() + after.hashCode();
  }

  @Override
  public String toString() {
    return "(" + before + " / " + after + ")";
  }
}
