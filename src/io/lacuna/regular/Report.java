package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * The rendered form of a DFA: its transition table, one row per named state, and the equivalent right-linear grammar.
 */
public class Report {

  public static final String HEADER = "      0 1";

  private final IList<String> rows;
  private final IList<Production> productions;

  Report(IList<String> rows, IList<Production> productions) {
    this.rows = rows;
    this.productions = productions;
  }

  /**
   * @return the table rows, in label order, e.g. {@code (s)q0 q1 N}
   */
  public IList<String> rows() {
    return rows;
  }

  public IList<Production> productions() {
    return productions;
  }

  /**
   * @return the header, the table rows, a blank line, and then the productions, each terminated by a newline
   */
  public String render() {
    StringBuilder sb = new StringBuilder(HEADER).append('\n');
    rows.forEach(r -> sb.append(r).append('\n'));
    sb.append('\n');
    productions.forEach(p -> sb.append(p).append('\n'));
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
