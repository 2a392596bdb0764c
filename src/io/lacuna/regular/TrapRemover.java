package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strips the trap state out of a DFA in place, so that undefined moves are {@link DFA#NONE} again rather than a
 * transition to a dead state. Calling it on a DFA without a trap does nothing.
 */
public class TrapRemover {

  private static final Logger LOG = LoggerFactory.getLogger(TrapRemover.class);

  private TrapRemover() {
  }

  public static void removeTrap(DFA dfa) {
    int trap = dfa.trap;
    if (trap == DFA.NONE) {
      return;
    }

    for (DFA.State s : dfa.states) {
      for (int idx = 0; idx < Signals.count(); idx++) {
        if (s.next[idx] == trap) {
          s.next[idx] = DFA.NONE;
        }
      }
    }

    DFA.State t = dfa.state(trap);
    t.accept = false;
    for (int idx = 0; idx < Signals.count(); idx++) {
      t.next[idx] = DFA.NONE;
    }
    dfa.trap = DFA.NONE;

    prune(dfa);
  }

  // drops every state which can't be reached from the start, renumbering the rest in their original order
  private static void prune(DFA dfa) {
    ISet<Integer> reachable = LinearSet.from(dfa.reachable());
    if (reachable.size() == dfa.size()) {
      return;
    }

    int[] ids = new int[dfa.size()];
    int count = 0;
    for (int i = 0; i < dfa.size(); i++) {
      ids[i] = reachable.contains(i) ? count++ : DFA.NONE;
    }

    LinearList<DFA.State> states = new LinearList<>();
    for (DFA.State s : dfa.states) {
      if (ids[s.id] != DFA.NONE) {
        DFA.State renamed = new DFA.State(ids[s.id], s.accept);
        for (int idx = 0; idx < Signals.count(); idx++) {
          renamed.next[idx] = s.next[idx] == DFA.NONE ? DFA.NONE : ids[s.next[idx]];
        }
        states.addLast(renamed);
      }
    }

    LOG.debug("pruned {} unreachable states", dfa.size() - count);
    dfa.states = states;
    dfa.start = ids[dfa.start];
  }
}
