package org.trypticon.regexdfa.syntax;

import org.junit.Test;
import org.trypticon.regexdfa.charmap.CharRange;
import org.trypticon.regexdfa.charmap.CharSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

/**
 * Tests for parsing with {@link RegExp}.
 */
public class RegExpTests {

  @Test
  public void testSingleChar() throws Exception {
    RegExp re = new RegExp("a");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_CHAR_CLASS));
    assertThat(re.chars, contains(CharRange.single('a')));
    assertThat(re.getOriginalString(), is("a"));
  }

  @Test
  public void testEmptyPattern() throws Exception {
    assertThat(new RegExp("").kind, is(RegExp.Kind.REGEXP_EMPTY));
    assertThat(new RegExp("()").kind, is(RegExp.Kind.REGEXP_EMPTY));
  }

  @Test
  public void testStructure() throws Exception {
    RegExp re = new RegExp("ab|c*");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_UNION));
    assertThat(re.exp1.kind, is(RegExp.Kind.REGEXP_CONCATENATION));
    assertThat(re.exp2.kind, is(RegExp.Kind.REGEXP_REPEAT));
    assertThat(re.toString(), is("(ab|(c)*)"));
  }

  @Test
  public void testRepeats() throws Exception {
    RegExp re = new RegExp("a{2,5}");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_REPEAT_MINMAX));
    assertThat(re.min, is(2));
    assertThat(re.max, is(5));

    re = new RegExp("a{3}");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_REPEAT_MINMAX));
    assertThat(re.min, is(3));
    assertThat(re.max, is(3));

    re = new RegExp("a{3,}");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_REPEAT_MIN));
    assertThat(re.min, is(3));

    re = new RegExp("a+");
    assertThat(re.kind, is(RegExp.Kind.REGEXP_REPEAT_MIN));
    assertThat(re.min, is(1));

    assertThat(new RegExp("a?").kind, is(RegExp.Kind.REGEXP_OPTIONAL));
  }

  @Test
  public void testLazyQuantifiersParseAsGreedy() throws Exception {
    assertThat(new RegExp("a*?").toString(), is(new RegExp("a*").toString()));
    assertThat(new RegExp("a+?b").toString(), is(new RegExp("a+b").toString()));
    assertThat(new RegExp("a{1,2}?").toString(), is(new RegExp("a{1,2}").toString()));
  }

  @Test
  public void testNonCapturingGroup() throws Exception {
    assertThat(new RegExp("(?:ab)*").toString(), is(new RegExp("(ab)*").toString()));
  }

  @Test
  public void testDot() throws Exception {
    assertThat(new RegExp(".").chars, is(CharSet.except("\n")));
    assertThat(new RegExp(".", RegExp.DOT_ALL).chars, is(CharSet.full()));
  }

  @Test
  public void testBracketClass() throws Exception {
    RegExp re = new RegExp("[a-cx_]");
    assertThat(re.chars, contains(new CharRange('_', '_'), new CharRange('a', 'c'), new CharRange('x', 'x')));

    re = new RegExp("[^a-c]");
    assertThat(re.chars.contains('b'), is(false));
    assertThat(re.chars.contains('d'), is(true));
    assertThat(re.chars.contains(0x10000), is(true));
  }

  @Test
  public void testBracketClassSpecials() throws Exception {
    RegExp re = new RegExp("[a-]");
    assertThat(re.chars.contains('-'), is(true));
    assertThat(re.chars.contains('a'), is(true));

    re = new RegExp("[\\d\\-x]");
    assertThat(re.chars.contains('5'), is(true));
    assertThat(re.chars.contains('-'), is(true));
    assertThat(re.chars.contains('x'), is(true));
    assertThat(re.chars.contains('y'), is(false));

    re = new RegExp("[\\x41-\\x43]");
    assertThat(re.chars, contains(new CharRange('A', 'C')));
  }

  @Test
  public void testEscapes() throws Exception {
    assertThat(new RegExp("\\d").chars, contains(new CharRange('0', '9')));
    assertThat(new RegExp("\\D").chars.contains('5'), is(false));
    assertThat(new RegExp("\\w").chars.contains('_'), is(true));
    assertThat(new RegExp("\\W").chars.contains('_'), is(false));
    assertThat(new RegExp("\\s").chars.charCount(), is(6));
    assertThat(new RegExp("\\S").chars.contains(' '), is(false));
    assertThat(new RegExp("\\n").chars, contains(CharRange.single('\n')));
    assertThat(new RegExp("\\t").chars, contains(CharRange.single('\t')));
    assertThat(new RegExp("\\v").chars, contains(CharRange.single(0x0B)));
    assertThat(new RegExp("\\0").chars, contains(CharRange.single(0)));
    assertThat(new RegExp("\\x7e").chars, contains(CharRange.single('~')));
    assertThat(new RegExp("\\x{1F600}").chars, contains(CharRange.single(0x1F600)));
    assertThat(new RegExp("\\u00e9").chars, contains(CharRange.single(0xE9)));
    assertThat(new RegExp("\\.").chars, contains(CharRange.single('.')));
    assertThat(new RegExp("\\[").chars, contains(CharRange.single('[')));
  }

  @Test
  public void testAnchors() throws Exception {
    assertThat(new RegExp("^").kind, is(RegExp.Kind.REGEXP_BEGIN_TEXT));
    assertThat(new RegExp("$").kind, is(RegExp.Kind.REGEXP_END_TEXT));
    assertThat(new RegExp("^", RegExp.MULTI_LINE).kind, is(RegExp.Kind.REGEXP_BEGIN_LINE));
    assertThat(new RegExp("$", RegExp.MULTI_LINE).kind, is(RegExp.Kind.REGEXP_END_LINE));
    assertThat(new RegExp("\\A", RegExp.MULTI_LINE).kind, is(RegExp.Kind.REGEXP_BEGIN_TEXT));
    assertThat(new RegExp("\\z", RegExp.MULTI_LINE).kind, is(RegExp.Kind.REGEXP_END_TEXT));
    assertThat(new RegExp("\\b").kind, is(RegExp.Kind.REGEXP_WORD_BOUNDARY));
    assertThat(new RegExp("\\B").kind, is(RegExp.Kind.REGEXP_NOT_WORD_BOUNDARY));
  }

  @Test
  public void testCaseInsensitive() throws Exception {
    RegExp re = new RegExp("a", RegExp.CASE_INSENSITIVE);
    assertThat(re.chars, contains(CharRange.single('A'), CharRange.single('a')));

    re = new RegExp("[b-d1]", RegExp.CASE_INSENSITIVE);
    assertThat(re.chars.contains('C'), is(true));
    assertThat(re.chars.contains('c'), is(true));
    assertThat(re.chars.contains('1'), is(true));

    re = new RegExp("[^a]", RegExp.CASE_INSENSITIVE);
    assertThat(re.chars.contains('a'), is(false));
    assertThat(re.chars.contains('A'), is(false));
    assertThat(re.chars.contains('b'), is(true));
  }

  @Test
  public void testToStringTree() throws Exception {
    assertThat(new RegExp("a|b*").toStringTree(),
        is("REGEXP_UNION\n" +
           "  REGEXP_CHAR_CLASS chars=[97-97]\n" +
           "  REGEXP_REPEAT\n" +
           "    REGEXP_CHAR_CLASS chars=[98-98]\n"));
  }

  @Test
  public void testSubExpressionsHaveNoOriginalString() throws Exception {
    assertThat(new RegExp("ab").exp1.getOriginalString(), is(nullValue()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIllegalFlags() throws Exception {
    new RegExp("a", 0x100);
  }

  @Test
  public void testErrors() {
    assertError("(ab", "expected ')' at position 3", 3);
    assertError("ab)", "end-of-string expected at position 2", 2);
    assertError("[ab", "expected ']' at position 3", 3);
    assertError("[]", "empty character class at position 0", 0);
    assertError("*a", "dangling meta character '*' at position 0", 0);
    assertError("a{", "integer expected at position 2", 2);
    assertError("a{2", "expected '}' at position 3", 3);
    assertError("a{3,2}", "invalid repetition: max (2) cannot be < min (3) at position 5", 5);
    assertError("[z-a]", "invalid range: from (122) cannot be > to (97) at position 1", 1);
    assertError("[\\d-z]", "illegal character range at position 1", 1);
    assertError("\\q", "illegal escape '\\q' at position 0", 0);
    assertError("\\xZZ", "illegal hexadecimal escape at position 0", 0);
    assertError("\\x{110000}", "hexadecimal escape out of range at position 0", 0);
    assertError("\\u12", "unexpected end-of-string at position 4", 4);
    assertError("a\\", "unexpected end-of-string at position 2", 2);
    assertError("(?<a)", "expected ':' at position 2", 2);
    assertError("[\\b]", "illegal escape in character class at position 1", 1);
  }

  private static void assertError(String pattern, String message, int position) {
    try {
      new RegExp(pattern);
      fail("expected InvalidPatternException for " + pattern);
    } catch (InvalidPatternException e) {
      assertThat(e.getMessage(), is(message));
      assertThat(e.getPattern(), is(pattern));
      assertThat(e.getPosition(), is(position));
    }
  }
}
