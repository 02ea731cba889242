package org.trypticon.regexdfa.charmap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * A set of code points, implemented as a sorted list of inclusive ranges.
 * <p>
 * The same ordering rules as {@link CharMap} apply. Operations that build a new set
 * ({@link #union}, {@link #intersect}, {@link #negated}) always return a sorted one.
 */
public final class CharSet implements Iterable<CharRange> {

  // Dummy value to associate with every range in the backing map
  private static final Object PRESENT = new Object();

  final CharMap<Object> map;

  public CharSet() {
    map = new CharMap<>();
  }

  public CharSet(int capacity) {
    map = new CharMap<>(capacity);
  }

  private CharSet(CharMap<Object> map) {
    this.map = map;
  }

  /** Set containing every code point. */
  public static CharSet full() {
    CharSet set = new CharSet(1);
    set.push(CharRange.full());
    return set;
  }

  /** Set containing a single code point. */
  public static CharSet single(int ch) {
    CharSet set = new CharSet(1);
    set.push(CharRange.single(ch));
    return set;
  }

  /**
   * Converts a character class, given as non-overlapping ranges in any order, into a set.
   *
   * @throws IllegalStateException if any of the ranges overlap.
   */
  public static CharSet fromRanges(Iterable<CharRange> ranges) {
    CharSet set = new CharSet();
    for (CharRange range : ranges) {
      set.push(range);
    }
    set.sort();
    return set;
  }

  /**
   * Creates a set containing every code point except the ones in {@code chars}.
   *
   * @param chars the excluded code points, sorted and without duplicates.
   * @throws IllegalArgumentException if {@code chars} is not sorted or has duplicates.
   */
  public static CharSet except(String chars) {
    if (chars.isEmpty()) {
      return full();
    }

    CharSet ret = new CharSet(chars.length() + 1);
    int nextAllowed = 0;
    int n = 0;
    for (int c : chars.codePoints().toArray()) {
      n = c;
      if (n > nextAllowed) {
        ret.push(new CharRange(nextAllowed, n - 1));
      } else if (n < nextAllowed) {
        throw new IllegalArgumentException("input to except must be sorted and unique: " + chars);
      }

      if (n < CharRange.MAX) {
        nextAllowed = n + 1;
      } else {
        break;
      }
    }

    if (n < CharRange.MAX) {
      ret.push(new CharRange(n + 1, CharRange.MAX));
    }
    return ret;
  }

  /** @see CharMap#sort() */
  public void sort() {
    map.sort();
  }

  /** @see CharMap#normalize() */
  public void normalize() {
    map.normalize();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Tests whether this set contains every code point. Assumes the set is normalized. */
  public boolean isFull() {
    return map.isFull();
  }

  /** Number of ranges in the set. */
  public int size() {
    return map.size();
  }

  /**
   * Adds a range to this set.
   *
   * @throws IllegalArgumentException if the range is empty.
   * @see CharMap#push
   */
  public void push(CharRange range) {
    map.push(range, PRESENT);
  }

  public boolean contains(int ch) {
    return map.get(ch) != null;
  }

  /** Number of code points in the set. */
  public int charCount() {
    int count = 0;
    for (CharMap.Entry<Object> elt : map) {
      count += elt.range.size();
    }
    return count;
  }

  @Override
  public Iterator<CharRange> iterator() {
    Iterator<CharMap.Entry<Object>> it = map.iterator();
    return new Iterator<CharRange>() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public CharRange next() {
        return it.next().range;
      }
    };
  }

  /** Maps every code point in this set to {@code value}. */
  public <T> CharMap<T> toCharMap(T value) {
    CharMap<T> ret = new CharMap<>(map.size());
    for (CharRange range : this) {
      ret.push(range, value);
    }
    return ret;
  }

  public CharSet union(CharSet other) {
    if (isEmpty()) {
      return other.copy();
    } else if (other.isEmpty()) {
      return copy();
    }

    CharMap<Object> a = map;
    CharMap<Object> b = other.map;
    CharSet ret = new CharSet(a.size() + b.size());
    int i1 = 0;
    int i2 = 0;
    CharRange cur = CharRange.EMPTY;

    while (i1 < a.size() || i2 < b.size()) {
      int start1 = i1 < a.size() ? a.entry(i1).range.start : Integer.MAX_VALUE;
      int start2 = i2 < b.size() ? b.entry(i2).range.start : Integer.MAX_VALUE;
      if (!cur.isEmpty() && Math.min(start1, start2) > cur.end) {
        ret.push(cur);
        cur = CharRange.EMPTY;
      }

      if (start1 < start2 || i2 >= b.size()) {
        cur = cur.cover(a.entry(i1++).range);
      } else {
        cur = cur.cover(b.entry(i2++).range);
      }
    }

    if (!cur.isEmpty()) {
      ret.push(cur);
    }
    ret.sort();
    return ret;
  }

  public CharSet intersect(CharSet other) {
    return new CharSet(map.intersect(other));
  }

  /** Returns the set of all code points not in this set. */
  public CharSet negated() {
    CharSet ret = new CharSet(map.size() + 1);
    int lastEnd = 0;

    for (CharRange range : this) {
      if (range.start > lastEnd) {
        ret.push(new CharRange(lastEnd, range.start - 1));
      }
      lastEnd = range.end + 1;
    }
    if (lastEnd <= CharRange.MAX) {
      ret.push(new CharRange(lastEnd, CharRange.MAX));
    }
    return ret;
  }

  /** Tests whether every code point in this set is ASCII. */
  public boolean isAscii() {
    return map.isEmpty() || map.entry(map.size() - 1).range.end <= 127;
  }

  /**
   * Tests whether this set contains every non-ASCII code point, not counting the
   * surrogate range.
   */
  public boolean containsNonAscii() {
    CharSet nonAscii = new CharSet(2);
    nonAscii.push(new CharRange(0x80, 0xD7FF));
    nonAscii.push(new CharRange(0xE000, CharRange.MAX));

    CharSet contained = intersect(nonAscii);
    contained.normalize();
    return nonAscii.equals(contained);
  }

  /** Projects this set onto ASCII, silently dropping everything above 127. */
  public AsciiSet toAsciiSet() {
    AsciiSet ret = new AsciiSet();
    for (CharRange range : this) {
      if (range.start < 128) {
        ret.addRange(range.start, Math.min(127, range.end));
      }
    }
    return ret;
  }

  private CharSet copy() {
    List<CharMap.Entry<Object>> elts = new ArrayList<>(map.size());
    for (CharMap.Entry<Object> elt : map) {
      elts.add(elt);
    }
    return new CharSet(CharMap.fromList(elts));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CharSet && map.equals(((CharSet) other).map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("[");
    for (CharRange range : this) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(range.start).append('-').append(range.end);
    }
    return b.append(']').toString();
  }
}
