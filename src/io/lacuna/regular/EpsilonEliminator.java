package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Folds the epsilon-closures of an epsilon-NFA into its transitions, yielding an NFA with the same state ids and no
 * epsilon-transitions.
 */
public class EpsilonEliminator {

  private static final Logger LOG = LoggerFactory.getLogger(EpsilonEliminator.class);

  private final NFA input;
  private final Function<Integer, LinearSet<Integer>> closure;

  public EpsilonEliminator(NFA input) {
    this.input = input;
    this.closure = Utils.memoize(s -> input.epsilonClosure(LinearSet.of(s)));
  }

  public static NFA eliminate(NFA input) {
    return new EpsilonEliminator(input).eliminate();
  }

  /**
   * @return the epsilon-closure of state {@code s} in the input automaton, in ascending order
   */
  public ISet<Integer> closure(int s) {
    return closure.apply(input.state(s).id);
  }

  public NFA eliminate() {

    // every closure is computed against the untouched input before anything is folded
    for (int i = 0; i < input.size(); i++) {
      closure.apply(i);
    }

    NFA output = new NFA();
    for (int i = 0; i < input.size(); i++) {
      output.newState();
    }
    output.start = input.start;

    for (int i = 0; i < input.size(); i++) {
      State s = output.state(i);
      ISet<Integer> members = closure.apply(i);

      s.accept = members.stream().anyMatch(t -> input.state(t).accept);

      for (int idx = 0; idx < Signals.count(); idx++) {
        char c = Signals.signal(idx);
        LinearSet<Integer> combined = new LinearSet<>();
        for (int t : members) {
          for (int next : input.state(t).transitions(c)) {
            closure.apply(next).forEach(combined::add);
          }
        }
        Utils.sorted(combined).forEach(dst -> s.addTransition(c, dst));
      }
    }

    LOG.debug("eliminated epsilon-transitions from {} states", output.size());
    return output;
  }
}
