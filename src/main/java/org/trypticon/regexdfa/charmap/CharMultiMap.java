package org.trypticon.regexdfa.charmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A multi-valued mapping from code points to values.
 * <p>
 * Unlike {@link CharMap}, ranges may overlap and the same range may appear more than
 * once. There is no ordering requirement.
 */
public final class CharMultiMap<T> implements Iterable<CharMap.Entry<T>> {

  private final List<CharMap.Entry<T>> elts;

  public CharMultiMap() {
    elts = new ArrayList<>();
  }

  private CharMultiMap(List<CharMap.Entry<T>> elts) {
    this.elts = elts;
  }

  /**
   * Adds a new mapping from a range to {@code value}.
   *
   * @throws IllegalArgumentException if the range is empty.
   */
  public void push(CharRange range, T value) {
    if (range.isEmpty()) {
      throw new IllegalArgumentException("ranges must be non-empty");
    }
    elts.add(new CharMap.Entry<>(range, Objects.requireNonNull(value, "value")));
  }

  public void addAll(Iterable<CharMap.Entry<T>> entries) {
    for (CharMap.Entry<T> entry : entries) {
      push(entry.range, entry.value);
    }
  }

  public int size() {
    return elts.size();
  }

  public boolean isEmpty() {
    return elts.isEmpty();
  }

  public CharMap.Entry<T> get(int index) {
    return elts.get(index);
  }

  /** Read-only view of the mappings, in the order they were added. */
  public List<CharMap.Entry<T>> entries() {
    return Collections.unmodifiableList(elts);
  }

  @Override
  public Iterator<CharMap.Entry<T>> iterator() {
    return Collections.unmodifiableList(elts).iterator();
  }

  /**
   * Returns the mappings restricted to the code points in {@code set}.
   */
  public CharMultiMap<T> intersect(CharSet set) {
    CharMap<Object> other = set.map;
    List<CharMap.Entry<T>> ret = new ArrayList<>();
    for (CharMap.Entry<T> elt : elts) {
      CharRange mine = elt.range;

      // first range of the set that does not end before ours starts
      int lo = 0;
      int hi = other.size();
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (other.entry(mid).range.end < mine.start) {
          lo = mid + 1;
        } else {
          hi = mid;
        }
      }

      for (int i = lo; i < other.size(); i++) {
        CharRange theirs = other.entry(i).range;
        if (theirs.start > mine.end) {
          break;
        }
        ret.add(new CharMap.Entry<>(mine.intersection(theirs), elt.value));
      }
    }
    return new CharMultiMap<>(ret);
  }

  /** Returns a copy containing only the mappings whose values satisfy {@code f}. */
  public CharMultiMap<T> filterValues(Predicate<? super T> f) {
    List<CharMap.Entry<T>> ret = new ArrayList<>();
    for (CharMap.Entry<T> elt : elts) {
      if (f.test(elt.value)) {
        ret.add(elt);
      }
    }
    return new CharMultiMap<>(ret);
  }

  /**
   * Splits the ranges so that any two ranges in the result are either identical or
   * disjoint. Each entry is replaced, in order, by the pieces it was cut into; every
   * piece keeps the entry's value.
   */
  public CharMultiMap<T> split() {
    int[] points = new int[elts.size() * 2];
    int numPoints = 0;
    for (CharMap.Entry<T> elt : elts) {
      points[numPoints++] = elt.range.start;
      if (elt.range.end < CharRange.MAX) {
        points[numPoints++] = elt.range.end + 1;
      }
    }

    Arrays.sort(points, 0, numPoints);
    int upto = 0;
    for (int i = 0; i < numPoints; i++) {
      if (upto == 0 || points[i] != points[upto - 1]) {
        points[upto++] = points[i];
      }
    }
    numPoints = upto;

    List<CharMap.Entry<T>> ret = new ArrayList<>(elts.size());
    for (CharMap.Entry<T> elt : elts) {
      CharRange range = elt.range;
      int idx = Arrays.binarySearch(points, 0, numPoints, range.start);
      idx = idx >= 0 ? idx + 1 : -idx - 1;
      int last = range.start;
      while (idx < numPoints && points[idx] <= range.end) {
        ret.add(new CharMap.Entry<>(new CharRange(last, points[idx] - 1), elt.value));
        last = points[idx];
        idx++;
      }
      ret.add(new CharMap.Entry<>(new CharRange(last, range.end), elt.value));
    }
    return new CharMultiMap<>(ret);
  }

  /**
   * Groups a map from ranges to state indices into a map from disjoint ranges to the set
   * of states reachable on each of them. The result is sorted by range start.
   */
  public static CharMap<BitSet> group(CharMultiMap<Integer> transitions) {
    Map<CharRange, BitSet> grouped = new HashMap<>();
    for (CharMap.Entry<Integer> elt : transitions.split()) {
      grouped.computeIfAbsent(elt.range, r -> new BitSet()).set(elt.value);
    }

    List<CharMap.Entry<BitSet>> ret = new ArrayList<>(grouped.size());
    for (Map.Entry<CharRange, BitSet> entry : grouped.entrySet()) {
      ret.add(new CharMap.Entry<>(entry.getKey(), entry.getValue()));
    }
    ret.sort(Comparator.comparingInt(e -> e.range.start));
    return CharMap.fromList(ret);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CharMultiMap && elts.equals(((CharMultiMap<?>) other).elts);
  }

  @Override
  public int hashCode() {
    return elts.hashCode();
  }

  @Override
  public String toString() {
    return elts.toString();
  }
}
