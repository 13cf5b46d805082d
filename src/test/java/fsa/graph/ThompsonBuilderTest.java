package fsa.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fsa.parser.Regex;
import fsa.util.Symbols;
import java.util.Collections;
import java.util.stream.Collectors;
import org.junit.Test;

public class ThompsonBuilderTest {

  @Test
  public void literal() {
    final var nfa = Nfa.parse("a");
    assertThat(nfa.states(), containsInAnyOrder(0, 1));
    assertThat(nfa.initial(), equalTo(0));
    assertThat(nfa.accepting(), contains(1));
    assertThat(nfa.targets(0, 'a'), contains(1));
    assertFalse(nfa.hasEpsilonTransitions());
  }

  @Test
  public void concatenationShiftsRightOperand() {
    final var nfa = Nfa.parse("ab");
    assertThat(nfa.states(), containsInAnyOrder(0, 1, 2, 3));
    assertThat(nfa.initial(), equalTo(0));
    assertThat(nfa.accepting(), contains(3));
    assertThat(nfa.targets(0, 'a'), contains(1));
    assertThat(nfa.epsilonTargets(1), contains(2));
    assertThat(nfa.targets(2, 'b'), contains(3));
  }

  @Test
  public void alternationForksAndJoins() {
    final var nfa = Nfa.parse("a|b");
    assertThat(nfa.states(), containsInAnyOrder(0, 1, 2, 3, 4, 5));
    assertThat(nfa.initial(), equalTo(0));
    assertThat(nfa.accepting(), contains(5));
    assertThat(nfa.epsilonTargets(0), containsInAnyOrder(1, 3));
    assertThat(nfa.targets(1, 'a'), contains(2));
    assertThat(nfa.targets(3, 'b'), contains(4));
    assertThat(nfa.epsilonTargets(2), contains(5));
    assertThat(nfa.epsilonTargets(4), contains(5));
  }

  @Test
  public void kleeneStarHasEnterExitRepeatAndSkip() {
    final var nfa = Nfa.parse("a*");
    assertThat(nfa.states(), containsInAnyOrder(0, 1, 2, 3));
    assertThat(nfa.accepting(), contains(3));
    assertThat(nfa.epsilonTargets(0), containsInAnyOrder(1, 3));
    assertThat(nfa.targets(1, 'a'), contains(2));
    assertThat(nfa.epsilonTargets(2), containsInAnyOrder(1, 3));
  }

  @Test
  public void stateIdsAreDenseAndDisjoint() {
    for (String pattern : new String[] { "a", "ab|c", "(a|b)*abb", "((ab)*|c*)d", "a(b|c)*d|e" }) {
      final var nfa = Nfa.parse(pattern);
      final int max = Collections.max(nfa.states());
      assertThat(pattern, nfa.states().size(), equalTo(max + 1));
      assertThat(pattern, nfa.accepting().size(), equalTo(1));
    }
  }

  @Test
  public void treeAndTextBuildTheSameAutomaton() {
    final String pattern = "(a|b)*a(b|c)";
    final var fromTree = Nfa.fromRegex(Regex.parse(pattern));
    final var fromText = Nfa.parse(pattern);
    assertThat(fromTree.states(), equalTo(fromText.states()));
    assertThat(fromTree.accepting(), equalTo(fromText.accepting()));
    assertThat(
      fromTree.edges().collect(Collectors.toList()),
      equalTo(fromText.edges().collect(Collectors.toList()))
    );
  }

  @Test
  public void alphabetIsTheLiteralsUsed() {
    assertThat(Nfa.parse("(a|b)*abb").alphabet(), containsInAnyOrder('a', 'b'));
    assertThat(Nfa.parse("x").targets(0, 'y'), empty());
  }

  @Test
  public void singleSymbol() {
    final var nfa = Nfa.parse("a");
    assertTrue(nfa.accepts(Symbols.chars("a")));
    assertFalse(nfa.accepts(Symbols.chars("")));
    assertFalse(nfa.accepts(Symbols.chars("b")));
  }

  @Test
  public void alternation() {
    final var nfa = Nfa.parse("a|b");
    assertTrue(nfa.accepts(Symbols.chars("a")));
    assertTrue(nfa.accepts(Symbols.chars("b")));
    assertFalse(nfa.accepts(Symbols.chars("ab")));
    assertFalse(nfa.accepts(Symbols.chars("")));
  }

  @Test
  public void kleeneStar() {
    final var nfa = Nfa.parse("a*");
    assertTrue(nfa.accepts(Symbols.chars("")));
    assertTrue(nfa.accepts(Symbols.chars("a")));
    assertTrue(nfa.accepts(Symbols.chars("aaaa")));
    assertFalse(nfa.accepts(Symbols.chars("b")));
  }

  @Test
  public void nestedStars() {
    final var nfa = Nfa.parse("(a*b*)*");
    assertTrue(nfa.accepts(Symbols.chars("")));
    assertTrue(nfa.accepts(Symbols.chars("abba")));
    assertFalse(nfa.accepts(Symbols.chars("abc")));
  }
}
