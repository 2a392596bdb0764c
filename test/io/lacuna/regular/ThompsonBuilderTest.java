package io.lacuna.regular;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ThompsonBuilderTest {

  private static final String[] REGEXES = {"0", "01", "0+1", "0*", "(0+1)*1", "(01*+1)*0", "0**", "((0))"};

  @Test
  public void testLiteral() {
    NFA nfa = ThompsonBuilder.build(RegexParser.parse("1"));

    assertEquals(2, nfa.size());
    assertEquals(0, nfa.start());
    assertTrue(nfa.state(0).transitions('1').contains(1));
    assertEquals(0, nfa.state(0).transitions('0').size());
    assertTrue(nfa.state(1).isAccept());
  }

  @Test
  public void testStarWiring() {
    NFA nfa = ThompsonBuilder.build(RegexParser.parse("0*"));

    // entry and exit come before the operand's states
    assertEquals(4, nfa.size());
    assertEquals(0, nfa.start());
    assertTrue(nfa.state(0).epsilonTransitions().contains(2));
    assertTrue(nfa.state(0).epsilonTransitions().contains(1));
    assertTrue(nfa.state(3).epsilonTransitions().contains(1));
    assertTrue(nfa.state(3).epsilonTransitions().contains(2));
    assertTrue(nfa.accepts(""));
  }

  @Test
  public void testSingleAcceptState() {
    for (String regex : REGEXES) {
      NFA nfa = ThompsonBuilder.build(RegexParser.parse(regex));
      assertEquals(1, nfa.states().stream().filter(State::isAccept).count(), regex);
    }
  }

  @Test
  public void testLinearStateCount() {
    for (String regex : REGEXES) {
      Regex ast = RegexParser.parse(regex);
      assertTrue(ThompsonBuilder.build(ast).size() <= 2 * ast.size(), regex);
    }
  }

  @Test
  public void testLongChain() {
    int n = 20000;
    NFA nfa = ThompsonBuilder.build(RegexParser.parse("0".repeat(n)));

    assertEquals(2 * n, nfa.size());
    assertEquals(0, nfa.start());
    assertTrue(nfa.state(2 * n - 1).isAccept());
    assertEquals(1, nfa.states().stream().filter(State::isAccept).count());
    assertTrue(nfa.state(1).epsilonTransitions().contains(2));
  }

  @Test
  public void testEmptyLanguage() {
    NFA nfa = ThompsonBuilder.build(Regex.NONE);

    assertEquals(1, nfa.size());
    assertFalse(nfa.state(0).isAccept());
    assertFalse(nfa.accepts(""));
    assertFalse(nfa.accepts("0"));
  }

  @Test
  public void testLanguage() {
    for (String regex : REGEXES) {
      Regex ast = RegexParser.parse(regex);
      NFA nfa = ThompsonBuilder.build(ast);
      for (String s : Languages.binaryStrings(6)) {
        assertEquals(Languages.matches(ast, s), nfa.accepts(s), regex + " on '" + s + "'");
      }
    }
  }
}
