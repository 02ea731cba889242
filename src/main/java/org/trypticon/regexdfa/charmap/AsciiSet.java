package org.trypticon.regexdfa.charmap;

/**
 * A set of ASCII characters, stored as a 128-bit mask.
 */
public final class AsciiSet {

  // bits 0-63 and 64-127
  private long lo;
  private long hi;

  public AsciiSet() {
  }

  public static AsciiSet lowerCaseLetters() {
    AsciiSet set = new AsciiSet();
    set.addRange('a', 'z');
    return set;
  }

  public void add(int ch) {
    checkAscii(ch);
    if (ch < 64) {
      lo |= 1L << ch;
    } else {
      hi |= 1L << (ch - 64);
    }
  }

  /** Adds every character from {@code start} to {@code end}, inclusive. */
  public void addRange(int start, int end) {
    for (int ch = start; ch <= end; ch++) {
      add(ch);
    }
  }

  public boolean contains(int ch) {
    if (ch < 0 || ch > 127) {
      return false;
    }
    return ch < 64 ? (lo & (1L << ch)) != 0 : (hi & (1L << (ch - 64))) != 0;
  }

  public int size() {
    return Long.bitCount(lo) + Long.bitCount(hi);
  }

  public boolean isEmpty() {
    return lo == 0 && hi == 0;
  }

  private static void checkAscii(int ch) {
    if (ch < 0 || ch > 127) {
      throw new IllegalArgumentException("not an ASCII character: " + ch);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof AsciiSet)) {
      return false;
    }
    AsciiSet that = (AsciiSet) other;
    return lo == that.lo && hi == that.hi;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(lo) * 31 + Long.hashCode(hi);
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("AsciiSet[");
    for (int ch = 0; ch < 128; ch++) {
      if (contains(ch)) {
        if (ch >= 0x21 && ch <= 0x7e) {
          b.append((char) ch);
        } else {
          b.append("\\x").append(Integer.toHexString(ch));
        }
      }
    }
    return b.append(']').toString();
  }
}
