package io.lacuna.regular;

/**
 * The fixed two-symbol alphabet, and the epsilon pseudo-signal used by the epsilon-NFA.
 */
public final class Signals {

  public static final char ZERO = '0';
  public static final char ONE = '1';

  // never a valid input character, only ever a transition label
  public static final char EPSILON = '\0';

  private static final char[] SIGNALS = {ZERO, ONE};

  private Signals() {
  }

  /**
   * @return the number of literal signals
   */
  public static int count() {
    return SIGNALS.length;
  }

  /**
   * @return the signal stored in DFA slot {@code idx}
   */
  public static char signal(int idx) {
    return SIGNALS[idx];
  }

  /**
   * @return the DFA slot for {@code signal}, or -1 if it isn't part of the alphabet
   */
  public static int index(char signal) {
    switch (signal) {
      case ZERO:
        return 0;
      case ONE:
        return 1;
      default:
        return -1;
    }
  }

  public static boolean isSignal(char c) {
    return index(c) >= 0;
  }
}
