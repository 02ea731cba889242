package org.trypticon.regexdfa.charmap;

/**
 * A range of code points, including both endpoints.
 * <p>
 * If {@code start} is strictly larger than {@code end} then the range is empty.
 */
public final class CharRange {

  /** Largest code point any range may contain. */
  public static final int MAX = Character.MAX_CODE_POINT;

  /** The canonical empty range. */
  public static final CharRange EMPTY = new CharRange(1, 0);

  public final int start;
  public final int end;

  public CharRange(int start, int end) {
    this.start = start;
    this.end = end;
  }

  /** Range containing every code point. */
  public static CharRange full() {
    return new CharRange(0, MAX);
  }

  /** Range containing a single code point. */
  public static CharRange single(int ch) {
    return new CharRange(ch, ch);
  }

  public boolean contains(int ch) {
    return start <= ch && ch <= end;
  }

  public boolean isEmpty() {
    return start > end;
  }

  /**
   * Intersects two ranges. The result is empty if they do not overlap.
   */
  public CharRange intersection(CharRange other) {
    return new CharRange(Math.max(start, other.start), Math.min(end, other.end));
  }

  /**
   * Returns the smallest range covering both {@code this} and {@code other}.
   * Empty ranges are ignored.
   */
  public CharRange cover(CharRange other) {
    if (isEmpty()) {
      return other;
    } else if (other.isEmpty()) {
      return this;
    } else {
      return new CharRange(Math.min(start, other.start), Math.max(end, other.end));
    }
  }

  /**
   * Compares this range against a single point: negative if the whole range is below
   * the point, positive if it is above it and zero if the point is inside.
   */
  public int compareToPoint(int ch) {
    if (end < ch) {
      return -1;
    } else if (start > ch) {
      return 1;
    } else {
      return 0;
    }
  }

  /** Number of code points in the range. */
  public int size() {
    return isEmpty() ? 0 : end - start + 1;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CharRange)) {
      return false;
    }
    CharRange that = (CharRange) other;
    return start == that.start && end == that.end;
  }

  @Override
  public int hashCode() {
    return 31 * start + end;
  }

  @Override
  public String toString() {
    return "[" + start + "-" + end + "]";
  }
}
