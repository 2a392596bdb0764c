package io.lacuna.regular;

/**
 * Thrown by {@link RegexParser} when the input isn't a well-formed expression.
 */
public class InvalidRegexException extends IllegalArgumentException {

  private final String input;
  private final int position;

  public InvalidRegexException(String input, int position, String reason) {
    super(reason + " at position " + position + " in '" + input + "'");
    this.input = input;
    this.position = position;
  }

  public String input() {
    return input;
  }

  /**
   * @return the 0-based offset of the offending character, or the input length if input ended early
   */
  public int position() {
    return position;
  }
}
