package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.Objects;

/**
 * An immutable regex syntax tree over the binary alphabet. Trees can be arbitrarily deep, so nothing here recurses.
 */
public final class Regex {

  public enum Type {
    LITERAL,
    CONCAT,
    UNION,
    STAR,
    NONE
  }

  /**
   * the empty language, which is what an empty input parses to
   */
  public static final Regex NONE = new Regex(Type.NONE, Signals.EPSILON, null, null);

  public final Type type;
  public final char signal;
  public final Regex left, right;

  private final int size, hash;

  private Regex(Type type, char signal, Regex left, Regex right) {
    this.type = type;
    this.signal = signal;
    this.left = left;
    this.right = right;

    this.size = 1 + (left == null ? 0 : left.size) + (right == null ? 0 : right.size);
    this.hash = Objects.hash(type, signal, left == null ? 0 : left.hash, right == null ? 0 : right.hash);
  }

  /// combinators

  public static Regex literal(char signal) {
    if (!Signals.isSignal(signal)) {
      throw new IllegalArgumentException("not a signal: '" + signal + "'");
    }
    return new Regex(Type.LITERAL, signal, null, null);
  }

  public static Regex concat(Regex left, Regex right) {
    return new Regex(Type.CONCAT, Signals.EPSILON, Objects.requireNonNull(left), Objects.requireNonNull(right));
  }

  public static Regex union(Regex left, Regex right) {
    return new Regex(Type.UNION, Signals.EPSILON, Objects.requireNonNull(left), Objects.requireNonNull(right));
  }

  public static Regex star(Regex operand) {
    return new Regex(Type.STAR, Signals.EPSILON, Objects.requireNonNull(operand), null);
  }

  ///

  /**
   * @return the number of nodes in the tree
   */
  public int size() {
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Regex)) {
      return false;
    }

    LinearList<Regex> stack = LinearList.of(this, (Regex) o);
    while (stack.size() > 0) {
      Regex a = stack.popLast();
      Regex b = stack.popLast();
      if (a == b) {
        continue;
      }
      if (a == null || b == null || a.hash != b.hash || a.size != b.size || a.type != b.type || a.signal != b.signal) {
        return false;
      }
      stack.addLast(a.left).addLast(b.left).addLast(a.right).addLast(b.right);
    }
    return true;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /**
   * @return a fully parenthesized rendering, e.g. {@code ((0+1)*1)}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();

    // holds either a node still to be rendered, or literal text
    LinearList<Object> stack = LinearList.of(this);
    while (stack.size() > 0) {
      Object o = stack.popLast();
      if (o instanceof String) {
        sb.append((String) o);
        continue;
      }

      Regex r = (Regex) o;
      switch (r.type) {
        case LITERAL:
          sb.append(r.signal);
          break;
        case CONCAT:
          stack.addLast(")").addLast(r.right).addLast(r.left).addLast("(");
          break;
        case UNION:
          stack.addLast(")").addLast(r.right).addLast("+").addLast(r.left).addLast("(");
          break;
        case STAR:
          stack.addLast("*").addLast(r.left);
          break;
        default:
          sb.append("none");
      }
    }
    return sb.toString();
  }
}
