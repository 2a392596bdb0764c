package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * A state within an {@link NFA}. Transitions are stored as state ids, so a state is only meaningful relative to the
 * automaton which created it.
 */
public class State {

  final int id;
  boolean accept = false;

  final LinearMap<Character, LinearSet<Integer>> transitions = new LinearMap<>();
  private LinearSet<Integer> epsilonTransitions = null;

  State(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  public boolean isAccept() {
    return accept;
  }

  public void addEpsilon(int state) {
    if (epsilonTransitions == null) {
      epsilonTransitions = new LinearSet<>();
    }
    epsilonTransitions.add(state);
  }

  public void addTransition(char signal, int state) {
    if (signal == Signals.EPSILON) {
      addEpsilon(state);
    } else if (!Signals.isSignal(signal)) {
      throw new IllegalArgumentException("not a signal: '" + signal + "'");
    } else {
      transitions.getOrCreate(signal, LinearSet::new).add(state);
    }
  }

  /**
   * @return the literal signals this state has transitions for, in alphabet order
   */
  public IList<Character> signals() {
    LinearList<Character> signals = new LinearList<>();
    for (int i = 0; i < Signals.count(); i++) {
      if (transitions.contains(Signals.signal(i))) {
        signals.addLast(Signals.signal(i));
      }
    }
    return signals;
  }

  public ISet<Integer> transitions(char signal) {
    if (signal == Signals.EPSILON) {
      return epsilonTransitions();
    }
    return transitions.get(signal).map(s -> (ISet<Integer>) s).orElseGet(LinearSet::new);
  }

  public ISet<Integer> epsilonTransitions() {
    return epsilonTransitions == null ? new LinearSet<>() : epsilonTransitions;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("state(" + id + ")");
    if (accept) {
      sb.append("[accept]");
    }
    return sb.toString();
  }
}
