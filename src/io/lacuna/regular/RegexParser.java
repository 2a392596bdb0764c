package io.lacuna.regular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A recursive descent parser for binary regexes. From loosest to tightest binding:
 *
 * <pre>
 *   union  := concat ('+' concat)*
 *   concat := star star*
 *   star   := base '*'*
 *   base   := '0' | '1' | '(' union ')'
 * </pre>
 *
 * Concatenation is implicit: anything other than the end of input, {@code ')'} or {@code '+'} starts another term.
 * Malformed input is rejected with an {@link InvalidRegexException}, and an empty input parses to {@link Regex#NONE}.
 * Only parentheses recurse, so groups may be nested at most {@link #MAX_DEPTH} deep, while chains of any length are
 * parsed iteratively.
 */
public class RegexParser {

  private static final Logger LOG = LoggerFactory.getLogger(RegexParser.class);

  public static final int MAX_DEPTH = 1000;

  private final String input;
  private int pos = 0;
  private int depth = 0;

  private RegexParser(String input) {
    this.input = input;
  }

  public static Regex parse(String input) {
    if (input.isEmpty()) {
      LOG.debug("empty input, parsing as the empty language");
      return Regex.NONE;
    }

    RegexParser parser = new RegexParser(input);
    Regex root = parser.union();
    if (parser.pos < input.length()) {
      // union() only stops early on a ')'
      throw parser.error("unbalanced ')'");
    }

    LOG.debug("parsed '{}' into {} nodes", input, root.size());
    return root;
  }

  ///

  private boolean atEnd() {
    return pos >= input.length();
  }

  private char peek() {
    return input.charAt(pos);
  }

  private InvalidRegexException error(String reason) {
    return new InvalidRegexException(input, pos, reason);
  }

  private Regex union() {
    Regex node = concat();
    while (!atEnd() && peek() == '+') {
      pos++;
      node = Regex.union(node, concat());
    }
    return node;
  }

  private Regex concat() {
    Regex node = star();
    while (!atEnd() && peek() != ')' && peek() != '+') {
      node = Regex.concat(node, star());
    }
    return node;
  }

  private Regex star() {
    Regex node = base();
    while (!atEnd() && peek() == '*') {
      pos++;
      node = Regex.star(node);
    }
    return node;
  }

  private Regex base() {
    if (atEnd()) {
      throw error("unexpected end of input");
    }

    char c = peek();
    switch (c) {
      case Signals.ZERO:
      case Signals.ONE:
        pos++;
        return Regex.literal(c);
      case '(':
        if (++depth > MAX_DEPTH) {
          throw error("groups nested more than " + MAX_DEPTH + " deep");
        }
        pos++;
        Regex node = union();
        if (atEnd() || peek() != ')') {
          throw error("missing ')'");
        }
        pos++;
        depth--;
        return node;
      case ')':
      case '+':
      case '*':
        throw error("unexpected '" + c + "'");
      default:
        throw error("illegal character '" + c + "'");
    }
  }
}
