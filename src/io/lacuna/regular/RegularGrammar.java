package io.lacuna.regular;

/**
 * The full pipeline, from a regex string to a minimal DFA and its right-linear grammar. Every intermediate automaton
 * is kept, so that each stage can be inspected.
 *
 * <pre>
 *   RegularGrammar g = RegularGrammar.compile("(0+1)*1");
 *   System.out.print(g.report().render());
 * </pre>
 */
public class RegularGrammar {

  public static class Options {
    boolean removeTrap = true;

    /**
     * @param removeTrap if false, the minimal DFA keeps its trap state, and is reported as a total automaton
     */
    public Options removeTrap(boolean removeTrap) {
      this.removeTrap = removeTrap;
      return this;
    }
  }

  private final Regex ast;
  private final NFA epsilonNfa, nfa;
  private final DFA dfa, minimalDfa;
  private final Report report;

  private RegularGrammar(Regex ast, NFA epsilonNfa, NFA nfa, DFA dfa, DFA minimalDfa, Report report) {
    this.ast = ast;
    this.epsilonNfa = epsilonNfa;
    this.nfa = nfa;
    this.dfa = dfa;
    this.minimalDfa = minimalDfa;
    this.report = report;
  }

  /**
   * @throws InvalidRegexException if {@code regex} is malformed
   */
  public static RegularGrammar compile(String regex) {
    return compile(regex, new Options());
  }

  public static RegularGrammar compile(String regex, Options options) {
    Regex ast = RegexParser.parse(regex);
    NFA epsilonNfa = ThompsonBuilder.build(ast);
    NFA nfa = EpsilonEliminator.eliminate(epsilonNfa);
    DFA dfa = SubsetConstructor.construct(nfa);
    DFA minimalDfa = Minimizer.minimize(dfa);
    if (options.removeTrap) {
      TrapRemover.removeTrap(minimalDfa);
    }

    return new RegularGrammar(ast, epsilonNfa, nfa, dfa, minimalDfa, Reporter.report(minimalDfa));
  }

  public Regex ast() {
    return ast;
  }

  public NFA epsilonNfa() {
    return epsilonNfa;
  }

  /**
   * @return the NFA without epsilon-transitions
   */
  public NFA nfa() {
    return nfa;
  }

  /**
   * @return the total DFA from subset construction, before minimization
   */
  public DFA dfa() {
    return dfa;
  }

  public DFA minimalDfa() {
    return minimalDfa;
  }

  public Report report() {
    return report;
  }
}
