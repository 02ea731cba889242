/*
 * dk.brics.automaton
 *
 * Copyright (c) 2001-2009 Anders Moeller
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR ``AS IS'' AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.trypticon.regexdfa.syntax;

import java.util.Arrays;

import org.trypticon.regexdfa.automaton.Predicate;
import org.trypticon.regexdfa.charmap.CharRange;
import org.trypticon.regexdfa.charmap.CharSet;

/**
 * Regular expression, parsed into an immutable tree.
 * <p>
 * The syntax is a subset of the one accepted by {@link java.util.regex.Pattern}:
 * <pre>
 * regexp   ::= unionexp
 * unionexp ::= concatexp ( '|' unionexp )?
 * concatexp ::= repeatexp*
 * repeatexp ::= atom ( '?' | '*' | '+' | '{' n '}' | '{' n ',}' | '{' n ',' m '}' ) '?'? ...
 * atom     ::= '.' | '^' | '$' | '(' unionexp ')' | '(?:' unionexp ')' | '[' '^'? classitem+ ']'
 *            | '\' escape | char
 * </pre>
 * A lazy quantifier ({@code *?} and so on) parses the same as a greedy one, since only the
 * set of matched strings matters here.
 */
public class RegExp {

  public enum Kind {
    REGEXP_UNION,
    REGEXP_CONCATENATION,
    REGEXP_OPTIONAL,
    REGEXP_REPEAT,
    REGEXP_REPEAT_MIN,
    REGEXP_REPEAT_MINMAX,
    REGEXP_CHAR_CLASS,
    REGEXP_EMPTY,
    REGEXP_BEGIN_TEXT,
    REGEXP_END_TEXT,
    REGEXP_BEGIN_LINE,
    REGEXP_END_LINE,
    REGEXP_WORD_BOUNDARY,
    REGEXP_NOT_WORD_BOUNDARY,
  }

  /** ASCII letters match regardless of case. */
  public static final int CASE_INSENSITIVE = 0x0001;

  /** {@code ^} and {@code $} match at line breaks as well as at the ends of the input. */
  public static final int MULTI_LINE = 0x0002;

  /** {@code .} matches {@code \n} as well. */
  public static final int DOT_ALL = 0x0004;

  public static final int ALL = 0x0007;

  public static final int NONE = 0x0000;

  private static final CharSet LOWER_CASE = CharSet.fromRanges(Arrays.asList(new CharRange('a', 'z')));

  private static final CharSet UPPER_CASE = CharSet.fromRanges(Arrays.asList(new CharRange('A', 'Z')));

  //Immutable parsed state
  public final Kind kind;
  public final RegExp exp1, exp2;
  public final CharSet chars;
  public final int min, max;
  public final int flags;

  // Parser variables
  private final String originalString;
  private int pos;

  public RegExp(String s) throws InvalidPatternException {
    this(s, NONE);
  }

  /**
   * Parses a pattern.
   *
   * @param s the pattern.
   * @param flags any of {@link #CASE_INSENSITIVE}, {@link #MULTI_LINE} and {@link #DOT_ALL}.
   * @throws InvalidPatternException if the pattern is malformed.
   * @throws IllegalArgumentException if {@code flags} has unknown bits set.
   */
  public RegExp(String s, int flags) throws InvalidPatternException {
    if ((flags & ~ALL) != 0) {
      throw new IllegalArgumentException("Illegal flags: " + flags);
    }
    originalString = s;
    this.flags = flags;
    RegExp e = parseUnionExp();
    if (pos < originalString.length()) {
      throw error("end-of-string expected", pos);
    }
    kind = e.kind;
    exp1 = e.exp1;
    exp2 = e.exp2;
    chars = e.chars;
    min = e.min;
    max = e.max;
  }

  private RegExp(int flags, Kind kind, RegExp exp1, RegExp exp2, CharSet chars, int min, int max) {
    this.originalString = null;
    this.flags = flags;
    this.kind = kind;
    this.exp1 = exp1;
    this.exp2 = exp2;
    this.chars = chars;
    this.min = min;
    this.max = max;
  }

  static RegExp newContainerNode(int flags, Kind kind, RegExp exp1, RegExp exp2) {
    return new RegExp(flags, kind, exp1, exp2, null, 0, 0);
  }

  static RegExp newRepeatingNode(int flags, Kind kind, RegExp exp, int min, int max) {
    return new RegExp(flags, kind, exp, null, null, min, max);
  }

  static RegExp newLeafNode(int flags, Kind kind, CharSet chars) {
    return new RegExp(flags, kind, null, null, chars, 0, 0);
  }

  /** The pattern this expression was parsed from, or {@code null} for a sub-expression. */
  public String getOriginalString() {
    return originalString;
  }

  /** Tests whether the given flag was set when parsing. */
  public boolean check(int flag) {
    return (flags & flag) != 0;
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    toStringBuilder(b);
    return b.toString();
  }

  void toStringBuilder(StringBuilder b) {
    switch (kind) {
      case REGEXP_UNION:
        b.append("(");
        exp1.toStringBuilder(b);
        b.append("|");
        exp2.toStringBuilder(b);
        b.append(")");
        break;
      case REGEXP_CONCATENATION:
        exp1.toStringBuilder(b);
        exp2.toStringBuilder(b);
        break;
      case REGEXP_OPTIONAL:
        b.append("(");
        exp1.toStringBuilder(b);
        b.append(")?");
        break;
      case REGEXP_REPEAT:
        b.append("(");
        exp1.toStringBuilder(b);
        b.append(")*");
        break;
      case REGEXP_REPEAT_MIN:
        b.append("(");
        exp1.toStringBuilder(b);
        b.append("){").append(min).append(",}");
        break;
      case REGEXP_REPEAT_MINMAX:
        b.append("(");
        exp1.toStringBuilder(b);
        b.append("){").append(min).append(",").append(max).append("}");
        break;
      case REGEXP_CHAR_CLASS:
        appendCharClass(b);
        break;
      case REGEXP_EMPTY:
        b.append("()");
        break;
      case REGEXP_BEGIN_TEXT:
        b.append("\\A");
        break;
      case REGEXP_END_TEXT:
        b.append("\\z");
        break;
      case REGEXP_BEGIN_LINE:
        b.append("(?m:^)");
        break;
      case REGEXP_END_LINE:
        b.append("(?m:$)");
        break;
      case REGEXP_WORD_BOUNDARY:
        b.append("\\b");
        break;
      case REGEXP_NOT_WORD_BOUNDARY:
        b.append("\\B");
        break;
    }
  }

  private void appendCharClass(StringBuilder b) {
    if (chars.size() == 1 && chars.charCount() == 1) {
      appendChar(chars.iterator().next().start, b);
      return;
    }
    b.append('[');
    for (CharRange range : chars) {
      appendChar(range.start, b);
      if (range.end != range.start) {
        b.append('-');
        appendChar(range.end, b);
      }
    }
    b.append(']');
  }

  private static void appendChar(int c, StringBuilder b) {
    if (Character.isLetterOrDigit(c)) {
      b.appendCodePoint(c);
    } else {
      b.append("\\x{").append(Integer.toHexString(c)).append('}');
    }
  }

  public String toStringTree() {
    StringBuilder b = new StringBuilder();
    toStringTree(b, "");
    return b.toString();
  }

  void toStringTree(StringBuilder b, String indent) {
    b.append(indent).append(kind);
    if (kind == Kind.REGEXP_REPEAT_MIN || kind == Kind.REGEXP_REPEAT_MINMAX) {
      b.append(" min=").append(min);
    }
    if (kind == Kind.REGEXP_REPEAT_MINMAX) {
      b.append(" max=").append(max);
    }
    if (kind == Kind.REGEXP_CHAR_CLASS) {
      b.append(" chars=").append(chars);
    }
    b.append('\n');
    String childIndent = indent + "  ";
    if (exp1 != null) {
      exp1.toStringTree(b, childIndent);
    }
    if (exp2 != null) {
      exp2.toStringTree(b, childIndent);
    }
  }

  static RegExp makeUnion(int flags, RegExp exp1, RegExp exp2) {
    return newContainerNode(flags, Kind.REGEXP_UNION, exp1, exp2);
  }

  static RegExp makeConcatenation(int flags, RegExp exp1, RegExp exp2) {
    if (exp1.kind == Kind.REGEXP_EMPTY) return exp2;
    if (exp2.kind == Kind.REGEXP_EMPTY) return exp1;
    return newContainerNode(flags, Kind.REGEXP_CONCATENATION, exp1, exp2);
  }

  static RegExp makeOptional(int flags, RegExp exp) {
    return newContainerNode(flags, Kind.REGEXP_OPTIONAL, exp, null);
  }

  static RegExp makeRepeat(int flags, RegExp exp) {
    return newContainerNode(flags, Kind.REGEXP_REPEAT, exp, null);
  }

  static RegExp makeRepeat(int flags, RegExp exp, int min) {
    return newRepeatingNode(flags, Kind.REGEXP_REPEAT_MIN, exp, min, 0);
  }

  static RegExp makeRepeat(int flags, RegExp exp, int min, int max) {
    return newRepeatingNode(flags, Kind.REGEXP_REPEAT_MINMAX, exp, min, max);
  }

  static RegExp makeCharClass(int flags, CharSet chars) {
    return newLeafNode(flags, Kind.REGEXP_CHAR_CLASS, chars);
  }

  static RegExp makeEmpty(int flags) {
    return newContainerNode(flags, Kind.REGEXP_EMPTY, null, null);
  }

  static RegExp makeAssertion(int flags, Kind kind) {
    return newContainerNode(flags, kind, null, null);
  }

  private InvalidPatternException error(String message, int position) {
    return new InvalidPatternException(message + " at position " + position, originalString, position);
  }

  private boolean peek(String s) {
    return more() && s.indexOf(originalString.codePointAt(pos)) != -1;
  }

  private boolean match(int c) {
    if (pos >= originalString.length()) return false;
    if (originalString.codePointAt(pos) == c) {
      pos += Character.charCount(c);
      return true;
    }
    return false;
  }

  private boolean more() {
    return pos < originalString.length();
  }

  private int next() throws InvalidPatternException {
    if (!more()) throw error("unexpected end-of-string", pos);
    int ch = originalString.codePointAt(pos);
    pos += Character.charCount(ch);
    return ch;
  }

  final RegExp parseUnionExp() throws InvalidPatternException {
    RegExp e = parseConcatExp();
    if (match('|')) e = makeUnion(flags, e, parseUnionExp());
    return e;
  }

  final RegExp parseConcatExp() throws InvalidPatternException {
    if (!more() || peek(")|")) return makeEmpty(flags);
    RegExp e = parseRepeatExp();
    if (more() && !peek(")|")) e = makeConcatenation(flags, e, parseConcatExp());
    return e;
  }

  final RegExp parseRepeatExp() throws InvalidPatternException {
    RegExp e = parseAtomExp();
    while (peek("?*+{")) {
      if (match('?')) e = makeOptional(flags, e);
      else if (match('*')) e = makeRepeat(flags, e);
      else if (match('+')) e = makeRepeat(flags, e, 1);
      else if (match('{')) {
        int n = parseInteger();
        int m = -1;
        if (match(',')) {
          if (peek("0123456789")) {
            m = parseInteger();
          }
        } else m = n;
        if (!match('}')) throw error("expected '}'", pos);
        if (m != -1 && m < n) throw error("invalid repetition: max (" + m + ") cannot be < min (" + n + ")", pos - 1);
        if (m == -1) e = makeRepeat(flags, e, n);
        else e = makeRepeat(flags, e, n, m);
      }
      // lazy quantifiers match the same strings
      match('?');
    }
    return e;
  }

  private int parseInteger() throws InvalidPatternException {
    int start = pos;
    while (peek("0123456789"))
      next();
    if (start == pos) throw error("integer expected", pos);
    try {
      return Integer.parseInt(originalString.substring(start, pos));
    } catch (NumberFormatException e) {
      throw error("integer too large", start);
    }
  }

  final RegExp parseAtomExp() throws InvalidPatternException {
    int start = pos;
    if (match('.')) {
      return makeCharClass(flags, check(DOT_ALL) ? CharSet.full() : CharSet.except("\n"));
    } else if (match('^')) {
      return makeAssertion(flags, check(MULTI_LINE) ? Kind.REGEXP_BEGIN_LINE : Kind.REGEXP_BEGIN_TEXT);
    } else if (match('$')) {
      return makeAssertion(flags, check(MULTI_LINE) ? Kind.REGEXP_END_LINE : Kind.REGEXP_END_TEXT);
    } else if (match('(')) {
      if (match('?') && !match(':')) throw error("expected ':'", pos);
      RegExp e = parseUnionExp();
      if (!match(')')) throw error("expected ')'", pos);
      return e;
    } else if (match('[')) {
      return makeCharClass(flags, parseCharClasses());
    } else if (match('\\')) {
      if (match('b')) return makeAssertion(flags, Kind.REGEXP_WORD_BOUNDARY);
      if (match('B')) return makeAssertion(flags, Kind.REGEXP_NOT_WORD_BOUNDARY);
      if (match('A')) return makeAssertion(flags, Kind.REGEXP_BEGIN_TEXT);
      if (match('z')) return makeAssertion(flags, Kind.REGEXP_END_TEXT);
      return makeCharClass(flags, fold(parseEscape(start)));
    } else if (peek("?*+{")) {
      throw error("dangling meta character '" + originalString.charAt(pos) + "'", pos);
    } else {
      return makeCharClass(flags, fold(CharSet.single(next())));
    }
  }

  /** Parses the body of a bracket class, after the opening '['. */
  final CharSet parseCharClasses() throws InvalidPatternException {
    int start = pos - 1;
    boolean negate = match('^');
    if (peek("]")) throw error("empty character class", start);
    CharSet ret = new CharSet();
    while (!match(']')) {
      if (!more()) throw error("expected ']'", pos);
      int itemStart = pos;
      CharSet item = parseCharClassItem();
      if (peek("-") && pos + 1 < originalString.length() && originalString.charAt(pos + 1) != ']') {
        match('-');
        CharSet to = parseCharClassItem();
        int from = singleChar(item);
        int upTo = singleChar(to);
        if (from < 0 || upTo < 0) {
          throw error("illegal character range", itemStart);
        }
        if (from > upTo) {
          throw error("invalid range: from (" + from + ") cannot be > to (" + upTo + ")", itemStart);
        }
        item = CharSet.fromRanges(Arrays.asList(new CharRange(from, upTo)));
      }
      ret = ret.union(item);
    }
    ret = fold(ret);
    return negate ? ret.negated() : ret;
  }

  private CharSet parseCharClassItem() throws InvalidPatternException {
    int start = pos;
    if (match('\\')) {
      if (peek("bBAz")) throw error("illegal escape in character class", start);
      return parseEscape(start);
    }
    return CharSet.single(next());
  }

  /** Adds the other case of every ASCII letter, if {@link #CASE_INSENSITIVE} is set. */
  private CharSet fold(CharSet set) {
    if (!check(CASE_INSENSITIVE)) {
      return set;
    }
    CharSet ret = set;
    for (CharRange r : set.intersect(LOWER_CASE)) {
      ret = ret.union(CharSet.fromRanges(Arrays.asList(new CharRange(r.start - 32, r.end - 32))));
    }
    for (CharRange r : set.intersect(UPPER_CASE)) {
      ret = ret.union(CharSet.fromRanges(Arrays.asList(new CharRange(r.start + 32, r.end + 32))));
    }
    return ret;
  }

  private static int singleChar(CharSet set) {
    if (set.size() == 1 && set.charCount() == 1) {
      return set.iterator().next().start;
    }
    return -1;
  }

  /** Parses an escape, after the backslash, into the set of characters it stands for. */
  final CharSet parseEscape(int start) throws InvalidPatternException {
    int c = next();
    switch (c) {
      case 'd': return digits();
      case 'D': return digits().negated();
      case 'w': return Predicate.wordChars();
      case 'W': return Predicate.wordChars().negated();
      case 's': return spaces();
      case 'S': return spaces().negated();
      case 'n': return CharSet.single('\n');
      case 'r': return CharSet.single('\r');
      case 't': return CharSet.single('\t');
      case 'f': return CharSet.single('\f');
      case 'v': return CharSet.single(0x0B);
      case '0': return CharSet.single(0);
      case 'x':
        if (match('{')) {
          int hexStart = pos;
          while (more() && !peek("}"))
            next();
          if (!match('}')) throw error("expected '}'", pos);
          return CharSet.single(parseHex(originalString.substring(hexStart, pos - 1), start));
        }
        return CharSet.single(parseHex(take(2), start));
      case 'u':
        return CharSet.single(parseHex(take(4), start));
      default:
        if (c < 128 && !Character.isLetterOrDigit(c)) {
          return CharSet.single(c);
        }
        throw error("illegal escape '\\" + new String(Character.toChars(c)) + "'", start);
    }
  }

  private static CharSet digits() {
    return CharSet.fromRanges(Arrays.asList(new CharRange('0', '9')));
  }

  private static CharSet spaces() {
    return CharSet.fromRanges(Arrays.asList(new CharRange('\t', '\r'), CharRange.single(' ')));
  }

  private String take(int count) throws InvalidPatternException {
    if (pos + count > originalString.length()) throw error("unexpected end-of-string", originalString.length());
    String s = originalString.substring(pos, pos + count);
    pos += count;
    return s;
  }

  private int parseHex(String digits, int start) throws InvalidPatternException {
    if (digits.isEmpty() || digits.length() > 6) throw error("illegal hexadecimal escape", start);
    int value = 0;
    for (int i = 0; i < digits.length(); i++) {
      int d = Character.digit(digits.charAt(i), 16);
      if (d < 0) throw error("illegal hexadecimal escape", start);
      value = value * 16 + d;
    }
    if (value > CharRange.MAX) throw error("hexadecimal escape out of range", start);
    return value;
  }
}
