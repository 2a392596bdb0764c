package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The powerset construction, taking an NFA without epsilon-transitions to a total DFA. Subsets are discovered breadth-first
 * from the start state, and the empty subset always becomes an explicit trap state.
 */
public class SubsetConstructor {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetConstructor.class);

  private final NFA nfa;

  private final LinearMap<ISet<Integer>, Integer> ids = new LinearMap<>();
  private final LinearList<ISet<Integer>> queue = new LinearList<>();

  private SubsetConstructor(NFA nfa) {
    this.nfa = nfa;
  }

  public static DFA construct(NFA nfa) {
    if (nfa.hasEpsilonTransitions()) {
      throw new IllegalStateException("epsilon-transitions must be eliminated before subset construction");
    }
    return new SubsetConstructor(nfa).construct();
  }

  private DFA construct() {
    DFA dfa = new DFA();

    enqueue(LinearSet.of(nfa.start));
    while (queue.size() > 0) {
      ISet<Integer> subset = queue.popFirst();

      DFA.State s = dfa.newState(subset.stream().anyMatch(n -> nfa.state(n).accept));
      for (int idx = 0; idx < Signals.count(); idx++) {
        s.next[idx] = enqueue(move(subset, Signals.signal(idx)));
      }
    }

    // the empty subset is never enqueued, so it always lands after every other state
    DFA.State trap = dfa.newState(false);
    ids.put(LinearSet.of(), trap.id);
    for (DFA.State s : dfa.states) {
      for (int idx = 0; idx < Signals.count(); idx++) {
        if (s.next[idx] == DFA.NONE) {
          s.next[idx] = trap.id;
        }
      }
    }

    dfa.start = 0;
    dfa.trap = trap.id;

    LOG.debug("constructed DFA with {} states from an NFA with {} states", dfa.size(), nfa.size());
    return dfa;
  }

  /**
   * @return the DFA id for {@code subset}, enqueueing it if it's new, or {@link DFA#NONE} if it's empty
   */
  private int enqueue(ISet<Integer> subset) {
    if (subset.size() == 0) {
      return DFA.NONE;
    }

    return ids.get(subset).orElseGet(() -> {
      int id = (int) ids.size();
      ids.put(subset, id);
      queue.addLast(subset);
      return id;
    });
  }

  private ISet<Integer> move(ISet<Integer> subset, char signal) {
    LinearSet<Integer> result = new LinearSet<>();
    subset.forEach(s -> nfa.state(s).transitions(signal).forEach(result::add));
    return Utils.sorted(result);
  }
}
