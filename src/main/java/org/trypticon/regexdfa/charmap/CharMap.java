package org.trypticon.regexdfa.charmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A map from code points to values, stored as a list of (range, value) pairs.
 * <p>
 * The ranges must not overlap and must be in ascending order. {@link #push} does not
 * check this: a caller that pushes out of order must call {@link #sort} before doing
 * anything else with the map.
 */
public final class CharMap<T> implements Iterable<CharMap.Entry<T>> {

  private List<Entry<T>> elts;

  public CharMap() {
    elts = new ArrayList<>();
  }

  public CharMap(int capacity) {
    elts = new ArrayList<>(capacity);
  }

  /** Wraps a list assumed to be sorted and non-overlapping already. */
  static <T> CharMap<T> fromList(List<Entry<T>> list) {
    CharMap<T> map = new CharMap<>(0);
    map.elts = list;
    return map;
  }

  /** Number of ranges; usually not the same as the number of mapped code points. */
  public int size() {
    return elts.size();
  }

  public boolean isEmpty() {
    return elts.isEmpty();
  }

  /**
   * Tests whether every code point is mapped. Assumes the map is {@link #normalize()}d.
   */
  public boolean isFull() {
    return elts.size() == 1 && elts.get(0).range.equals(CharRange.full());
  }

  /** Returns the entry at the given position in range order. */
  public Entry<T> entry(int index) {
    return elts.get(index);
  }

  /** Read-only view of the entries in range order. */
  public List<Entry<T>> entries() {
    return Collections.unmodifiableList(elts);
  }

  @Override
  public Iterator<Entry<T>> iterator() {
    return Collections.unmodifiableList(elts).iterator();
  }

  /**
   * Merges neighbouring ranges that map to equal values.
   */
  public void normalize() {
    List<Entry<T>> merged = new ArrayList<>(elts.size());
    for (Entry<T> elt : elts) {
      if (!merged.isEmpty()) {
        Entry<T> last = merged.get(merged.size() - 1);
        if (elt.range.start == last.range.end + 1 && elt.value.equals(last.value)) {
          merged.set(merged.size() - 1, new Entry<>(new CharRange(last.range.start, elt.range.end), last.value));
          continue;
        }
      }
      merged.add(elt);
    }
    elts = merged;
  }

  /**
   * Maps the given range to the given value.
   *
   * @throws IllegalArgumentException if the range is empty.
   */
  public void push(CharRange range, T value) {
    if (range.isEmpty()) {
      throw new IllegalArgumentException("ranges must be non-empty");
    }
    elts.add(new Entry<>(range, Objects.requireNonNull(value, "value")));
  }

  /** Adds every entry of {@code entries}; call {@link #sort} afterwards if they were out of order. */
  public void addAll(Iterable<Entry<T>> entries) {
    for (Entry<T> entry : entries) {
      push(entry.range, entry.value);
    }
  }

  /**
   * Sorts the ranges by their start.
   *
   * @throws IllegalStateException if any two ranges overlap.
   */
  public void sort() {
    elts.sort(Comparator.comparingInt(e -> e.range.start));
    for (int i = 1; i < elts.size(); i++) {
      if (elts.get(i - 1).range.end >= elts.get(i).range.start) {
        throw new IllegalStateException("overlapping ranges: " + elts.get(i - 1).range + " and " + elts.get(i).range);
      }
    }
  }

  /**
   * Looks up a code point.
   *
   * @return the mapped value, or {@code null} if the point is not mapped.
   */
  public T get(int ch) {
    int lo = 0;
    int hi = elts.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      Entry<T> elt = elts.get(mid);
      int cmp = elt.range.compareToPoint(ch);
      if (cmp < 0) {
        lo = mid + 1;
      } else if (cmp > 0) {
        hi = mid - 1;
      } else {
        return elt.value;
      }
    }
    return null;
  }

  /**
   * Restricts this map to the code points in {@code set}, keeping the original values.
   */
  public CharMap<T> intersect(CharSet set) {
    List<Entry<T>> ret = new ArrayList<>();
    CharMap<Object> other = set.map;
    int j = 0;
    for (Entry<T> elt : elts) {
      CharRange r = elt.range;
      while (j < other.size()) {
        CharRange s = other.entry(j).range;
        if (s.end >= r.start && s.start <= r.end) {
          ret.add(new Entry<>(r.intersection(s), elt.value));
        }
        if (s.end >= r.end) {
          break;
        }
        j++;
      }
    }
    return fromList(ret);
  }

  /** Returns the set of mapped code points, forgetting the values. */
  public CharSet toCharSet() {
    CharSet set = new CharSet(elts.size());
    for (Entry<T> elt : elts) {
      set.push(elt.range);
    }
    set.sort();
    return set;
  }

  /** Replaces every value in place. */
  public void mapValues(UnaryOperator<T> f) {
    for (int i = 0; i < elts.size(); i++) {
      Entry<T> elt = elts.get(i);
      elts.set(i, new Entry<>(elt.range, Objects.requireNonNull(f.apply(elt.value))));
    }
  }

  /** Returns a copy containing only the entries whose values satisfy {@code f}. */
  public CharMap<T> filterValues(Predicate<? super T> f) {
    List<Entry<T>> ret = new ArrayList<>();
    for (Entry<T> elt : elts) {
      if (f.test(elt.value)) {
        ret.add(elt);
      }
    }
    return fromList(ret);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CharMap && elts.equals(((CharMap<?>) other).elts);
  }

  @Override
  public int hashCode() {
    return elts.hashCode();
  }

  @Override
  public String toString() {
    return elts.toString();
  }

  /**
   * A single mapped range.
   */
  public static final class Entry<T> {
    public final CharRange range;
    public final T value;

    public Entry(CharRange range, T value) {
      this.range = range;
      this.value = value;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Entry)) {
        return false;
      }
      Entry<?> that = (Entry<?>) other;
      return range.equals(that.range) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return 31 * range.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
      return range + "=" + value;
    }
  }
}
