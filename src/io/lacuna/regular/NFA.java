package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * A nondeterministic automaton, with or without epsilon-transitions. State ids are dense and 0-based, and are assigned in
 * creation order.
 */
public class NFA {

  final LinearList<State> states = new LinearList<>();
  int start = 0;

  public State newState() {
    State s = new State((int) states.size());
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

  public int start() {
    return start;
  }

  public IList<State> states() {
    return states;
  }

  public boolean hasEpsilonTransitions() {
    return states.stream().anyMatch(s -> s.epsilonTransitions().size() > 0);
  }

  /**
   * @return the states reachable from {@code states} via zero or more epsilon-transitions
   */
  public LinearSet<Integer> epsilonClosure(ISet<Integer> states) {
    LinearSet<Integer> accumulator = new LinearSet<>();
    LinearList<Integer> stack = new LinearList<>();
    states.forEach(stack::addLast);

    while (stack.size() > 0) {
      int s = stack.popLast();
      if (!accumulator.contains(s)) {
        accumulator.add(s);
        state(s).epsilonTransitions().forEach(stack::addLast);
      }
    }

    return Utils.sorted(accumulator);
  }

  /**
   * @return true if {@code input} is accepted, following epsilon-transitions wherever they exist
   */
  public boolean accepts(String input) {
    ISet<Integer> current = epsilonClosure(LinearSet.of(start));
    for (int i = 0; i < input.length() && current.size() > 0; i++) {
      char c = input.charAt(i);
      if (!Signals.isSignal(c)) {
        return false;
      }
      LinearSet<Integer> next = new LinearSet<>();
      current.forEach(s -> state(s).transitions(c).forEach(next::add));
      current = epsilonClosure(next);
    }
    return current.stream().anyMatch(s -> state(s).accept);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (State s : states) {
      sb.append(s.id == start ? "-> " : "   ").append(s);
      for (char c : s.signals()) {
        sb.append(' ').append(c).append(Utils.sorted(s.transitions(c)));
      }
      if (s.epsilonTransitions().size() > 0) {
        sb.append(" epsilon").append(Utils.sorted(s.epsilonTransitions()));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
