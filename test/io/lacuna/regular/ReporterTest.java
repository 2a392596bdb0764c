package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReporterTest {

  private static Report report(String regex) {
    return RegularGrammar.compile(regex).report();
  }

  private static List<String> productions(String regex) {
    return report(regex).productions().stream().map(Production::toString).collect(Collectors.toList());
  }

  private static List<String> rows(String regex) {
    return report(regex).rows().stream().collect(Collectors.toList());
  }

  @Test
  public void testSingleLiteral() {
    assertEquals(List.of("(s)q0 q1 N", "(e)q1 N N"), rows("0"));
    assertEquals(List.of("q0->0"), productions("0"));
  }

  @Test
  public void testStar() {
    assertEquals(List.of("(s)(e)q0 q0 N"), rows("0*"));
    assertEquals(List.of("q0->0q0", "q0->0"), productions("0*"));
  }

  @Test
  public void testSharedAcceptingSink() {
    assertEquals(List.of("(s)q0 q1 q1", "(e)q1 N N"), rows("0+1"));
    assertEquals(List.of("q0->0", "q0->1"), productions("0+1"));
  }

  @Test
  public void testUniversalLanguage() {
    assertEquals(List.of("(s)(e)q0 q0 q0"), rows("(0+1)*"));
    assertEquals(List.of("q0->0q0", "q0->1q0", "q0->0", "q0->1"), productions("(0+1)*"));
  }

  @Test
  public void testChain() {
    assertEquals(List.of("(s)q0 q1 N", "q1 q2 N", "(e)q2 N N"), rows("00"));
    assertEquals(List.of("q0->0q1", "q1->0"), productions("00"));
  }

  @Test
  public void testNonTerminalsBeforeTerminals() {
    // q1 accepts and has outgoing moves, so it yields both forms, non-terminals first
    assertEquals(List.of("(s)q0 q0 q1", "(e)q1 q0 q1"), rows("(0+1)*1"));
    assertEquals(List.of("q0->0q0", "q0->1q1", "q0->1", "q1->0q0", "q1->1q1", "q1->1"), productions("(0+1)*1"));
  }

  @Test
  public void testRender() {
    String expected = "      0 1\n"
            + "(s)q0 q1 N\n"
            + "(e)q1 N N\n"
            + "\n"
            + "q0->0\n";
    assertEquals(expected, report("0").render());
  }

  @Test
  public void testEmptyLanguage() {
    assertEquals("      0 1\n(s)q0 N N\n\n", report("").render());
  }

  @Test
  public void testBreadthFirstNaming() {
    DFA dfa = RegularGrammar.compile("1(0+1)*0").minimalDfa();
    IMap<Integer, String> names = Reporter.names(dfa);

    assertEquals("q0", names.get(dfa.start()).get());
    assertEquals("q1", names.get(dfa.state(dfa.start()).next('1')).get());
    assertEquals(dfa.size(), names.size());
  }

  @Test
  public void testUnreachableStatesAreNotNamed() {
    DFA dfa = new DFA();
    DFA.State a = dfa.newState(false);
    DFA.State b = dfa.newState(true);
    DFA.State orphan = dfa.newState(true);
    dfa.start = a.id;
    a.setNext('1', b.id);
    orphan.setNext('0', a.id);

    Report report = Reporter.report(dfa);
    assertEquals(List.of("(s)q0 N q1", "(e)q1 N N"), report.rows().stream().collect(Collectors.toList()));
    assertEquals(List.of("q0->1"), report.productions().stream().map(Production::toString).collect(Collectors.toList()));
    assertFalse(Reporter.names(dfa).contains(orphan.id));
  }

  @Test
  public void testKeepingTheTrap() {
    Report report = RegularGrammar.compile("0", new RegularGrammar.Options().removeTrap(false)).report();

    assertEquals(List.of("(s)q0 q1 q2", "(e)q1 q2 q2", "q2 q2 q2"), report.rows().stream().collect(Collectors.toList()));
    assertEquals(List.of("q0->0q1", "q0->1q2", "q0->0", "q1->0q2", "q1->1q2", "q2->0q2", "q2->1q2"),
            report.productions().stream().map(Production::toString).collect(Collectors.toList()));
  }
}
