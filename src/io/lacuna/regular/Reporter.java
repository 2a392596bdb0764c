package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names the states of a DFA and derives its transition table and right-linear grammar.
 * <p>
 * States are labelled {@code q0, q1, ...} in breadth-first order from the start state. States which aren't reachable
 * from the start are never labelled, and so don't appear in either the table or the grammar.
 */
public class Reporter {

  private static final Logger LOG = LoggerFactory.getLogger(Reporter.class);

  public static final String START_MARKER = "(s)";
  public static final String ACCEPT_MARKER = "(e)";
  public static final String NO_TRANSITION = "N";

  private final DFA dfa;
  private final IList<Integer> order;
  private final LinearMap<Integer, String> names = new LinearMap<>();

  private Reporter(DFA dfa) {
    this.dfa = dfa;
    this.order = dfa.reachable();
    order.forEach(s -> names.put(s, "q" + names.size()));
  }

  public static Report report(DFA dfa) {
    return new Reporter(dfa).report();
  }

  /**
   * @return each reachable state id mapped onto its label
   */
  public static IMap<Integer, String> names(DFA dfa) {
    return new Reporter(dfa).names;
  }

  private Report report() {
    LinearList<String> rows = new LinearList<>();
    LinearList<Production> productions = new LinearList<>();

    for (int s : order) {
      rows.addLast(row(dfa.state(s)));
      productions(dfa.state(s)).forEach(productions::addLast);
    }

    LOG.debug("reported {} of {} states, with {} productions", order.size(), dfa.size(), productions.size());
    return new Report(rows, productions);
  }

  private String name(int state) {
    return state == DFA.NONE ? null : names.get(state, null);
  }

  private String row(DFA.State s) {
    StringBuilder sb = new StringBuilder();
    if (s.id == dfa.start) {
      sb.append(START_MARKER);
    }
    if (s.accept) {
      sb.append(ACCEPT_MARKER);
    }
    sb.append(name(s.id));
    for (int n : s.next) {
      String name = name(n);
      sb.append(' ').append(name == null ? NO_TRANSITION : name);
    }
    return sb.toString();
  }

  /**
   * For each signal leading to a named state {@code Y}, yields {@code X -> cY} unless {@code Y} is an accepting dead
   * end, and then {@code X -> c} for each signal where {@code Y} accepts.
   */
  private IList<Production> productions(DFA.State s) {
    LinearList<Production> nonTerminals = new LinearList<>();
    LinearList<Production> terminals = new LinearList<>();

    String head = name(s.id);
    for (int idx = 0; idx < Signals.count(); idx++) {
      String tail = name(s.next[idx]);
      if (tail == null) {
        continue;
      }

      char c = Signals.signal(idx);
      DFA.State next = dfa.state(s.next[idx]);
      if (!(next.accept && next.isDeadEnd())) {
        nonTerminals.addLast(Production.nonTerminal(head, c, tail));
      }
      if (next.accept) {
        terminals.addLast(Production.terminal(head, c));
      }
    }

    terminals.forEach(nonTerminals::addLast);
    return nonTerminals;
  }
}
