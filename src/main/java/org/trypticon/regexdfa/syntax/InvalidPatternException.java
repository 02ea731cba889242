package org.trypticon.regexdfa.syntax;

/**
 * Thrown when a pattern cannot be parsed.
 */
public class InvalidPatternException extends Exception {
  private final String pattern;
  private final int position;

  public InvalidPatternException(String message, String pattern, int position) {
    super(message);
    this.pattern = pattern;
    this.position = position;
  }

  public String getPattern() {
    return pattern;
  }

  /** Index into the pattern, in chars, where the problem was found. */
  public int getPosition() {
    return position;
  }
}
