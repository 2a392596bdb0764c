package io.lacuna.regular;

import java.util.Objects;

/**
 * A right-linear production, either {@code X -> cY} or the terminal {@code X -> c}.
 */
public final class Production {

  public final String head;
  public final char signal;
  public final String tail;

  private Production(String head, char signal, String tail) {
    this.head = Objects.requireNonNull(head);
    this.signal = signal;
    this.tail = tail;
  }

  public static Production nonTerminal(String head, char signal, String tail) {
    return new Production(head, signal, Objects.requireNonNull(tail));
  }

  public static Production terminal(String head, char signal) {
    return new Production(head, signal, null);
  }

  public boolean isTerminal() {
    return tail == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Production)) {
      return false;
    }
    Production p = (Production) o;
    return signal == p.signal && head.equals(p.head) && Objects.equals(tail, p.tail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(head, signal, tail);
  }

  @Override
  public String toString() {
    return head + "->" + signal + (tail == null ? "" : tail);
  }
}
