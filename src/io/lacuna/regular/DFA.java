package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.Arrays;

/**
 * A deterministic automaton over the binary alphabet. Each state has exactly one slot per signal, holding either a
 * destination id or {@link #NONE}.
 */
public class DFA {

  public static final int NONE = -1;

  public static class State {
    final int id;
    boolean accept;
    final int[] next = new int[Signals.count()];

    State(int id, boolean accept) {
      this.id = id;
      this.accept = accept;
      Arrays.fill(next, NONE);
    }

    public int id() {
      return id;
    }

    public boolean isAccept() {
      return accept;
    }

    /**
     * @return the destination for {@code signal}, or {@link #NONE}
     */
    public int next(char signal) {
      return next[slot(signal)];
    }

    public int next(int idx) {
      return next[idx];
    }

    public void setNext(char signal, int state) {
      next[slot(signal)] = state;
    }

    /**
     * @return true if neither signal leads anywhere
     */
    public boolean isDeadEnd() {
      for (int n : next) {
        if (n != NONE) {
          return false;
        }
      }
      return true;
    }

    private static int slot(char signal) {
      int idx = Signals.index(signal);
      if (idx < 0) {
        throw new IllegalArgumentException("not a signal: '" + signal + "'");
      }
      return idx;
    }

    @Override
    public String toString() {
      return "state(" + id + ")" + (accept ? "[accept]" : "");
    }
  }

  LinearList<State> states = new LinearList<>();
  int start = NONE;
  int trap = NONE;

  public State newState(boolean accept) {
    State s = new State((int) states.size(), accept);
    states.addLast(s);
    return s;
  }

  public State state(int id) {
    if (id < 0 || id >= states.size()) {
      throw new IllegalStateException("no state " + id + " in an automaton with " + states.size() + " states");
    }
    return states.nth(id);
  }

  public int size() {
    return (int) states.size();
  }

  public IList<State> states() {
    return states;
  }

  public int start() {
    return start;
  }

  /**
   * @return the id of the trap state, or {@link #NONE} if it has been removed
   */
  public int trap() {
    return trap;
  }

  /**
   * @return true if every state has a destination for every signal
   */
  public boolean isTotal() {
    return states.stream().allMatch(s -> {
      for (int n : s.next) {
        if (n == NONE) {
          return false;
        }
      }
      return true;
    });
  }

  public ISet<Integer> acceptStates() {
    return Utils.toSet(states.stream().filter(s -> s.accept).map(s -> s.id));
  }

  /**
   * @return the ids reachable from the start state, in breadth-first order with signal {@code 0} explored first
   */
  public IList<Integer> reachable() {
    LinearList<Integer> order = new LinearList<>();
    if (start == NONE) {
      return order;
    }

    LinearSet<Integer> visited = LinearSet.of(start);
    LinearList<Integer> queue = LinearList.of(start);
    while (queue.size() > 0) {
      int s = queue.popFirst();
      order.addLast(s);
      for (int n : state(s).next) {
        if (n != NONE && !visited.contains(n)) {
          visited.add(n);
          queue.addLast(n);
        }
      }
    }
    return order;
  }

  public boolean accepts(String input) {
    int s = start;
    for (int i = 0; i < input.length() && s != NONE; i++) {
      int idx = Signals.index(input.charAt(i));
      if (idx < 0) {
        return false;
      }
      s = state(s).next[idx];
    }
    return s != NONE && state(s).accept;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (State s : states) {
      sb.append(s.id == start ? "-> " : "   ").append(s);
      if (s.id == trap) {
        sb.append("[trap]");
      }
      for (int i = 0; i < Signals.count(); i++) {
        sb.append(' ').append(Signals.signal(i)).append(':').append(s.next[i] == NONE ? "-" : s.next[i]);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
