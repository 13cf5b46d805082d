package fsa.graph;

import fsa.parser.RegexVisitor;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Regex AST visitor which builds the corresponding NFA with Thompson's
 * construction.
 *
 * Every rule returns a fresh NFA numbered from zero. Sub-automata are
 * embedded into their parent at an explicit offset, and embedding returns the
 * next free state id, which the rule threads along to the next embedding.
 * Sibling sub-automata therefore never share a state id and their
 * transitions can be merged by plain union.
 */
final class ThompsonBuilder implements RegexVisitor<Nfa<Integer, Character>> {

  /**
   * Literal {@code c}: {@code 0 -c-> 1}.
   */
  @Override
  public Nfa<Integer, Character> visitLiteral(char symbol) {
    return new Nfa.Builder<Integer, Character>()
      .addSymbol(symbol)
      .addState(0)
      .addState(1)
      .setInitial(0)
      .addAccepting(1)
      .addTransition(0, symbol, 1)
      .build();
  }

  /**
   * Concatenation: the finals of {@code lhs} get epsilon edges to the initial
   * state of {@code rhs}.
   */
  @Override
  public Nfa<Integer, Character> visitConcatenation(
    Nfa<Integer, Character> lhs,
    Nfa<Integer, Character> rhs
  ) {
    final var builder = new Nfa.Builder<Integer, Character>();
    final int rhsOffset = embed(builder, lhs, 0);
    embed(builder, rhs, rhsOffset);

    final int rhsInitial = rhs.initial() + rhsOffset;
    for (int lhsFinal : lhs.accepting()) {
      builder.addEpsilonTransition(lhsFinal, rhsInitial);
    }
    for (int rhsFinal : shifted(rhs.accepting(), rhsOffset)) {
      builder.addAccepting(rhsFinal);
    }
    return builder.setInitial(lhs.initial()).build();
  }

  /**
   * Alternation: a new initial state forks into both branches and both
   * branches join into a new final state.
   */
  @Override
  public Nfa<Integer, Character> visitAlternation(
    Nfa<Integer, Character> lhs,
    Nfa<Integer, Character> rhs
  ) {
    final var builder = new Nfa.Builder<Integer, Character>();
    final int initial = 0;
    final int lhsOffset = 1;
    final int rhsOffset = embed(builder, lhs, lhsOffset);
    final int finalState = embed(builder, rhs, rhsOffset);

    builder
      .addState(initial)
      .addState(finalState)
      .setInitial(initial)
      .addAccepting(finalState)
      .addEpsilonTransition(initial, lhs.initial() + lhsOffset)
      .addEpsilonTransition(initial, rhs.initial() + rhsOffset);
    for (int lhsFinal : shifted(lhs.accepting(), lhsOffset)) {
      builder.addEpsilonTransition(lhsFinal, finalState);
    }
    for (int rhsFinal : shifted(rhs.accepting(), rhsOffset)) {
      builder.addEpsilonTransition(rhsFinal, finalState);
    }
    return builder.build();
  }

  /**
   * Kleene star: enter, exit, repeat, and skip edges around the inner NFA.
   */
  @Override
  public Nfa<Integer, Character> visitKleene(Nfa<Integer, Character> inner) {
    final var builder = new Nfa.Builder<Integer, Character>();
    final int initial = 0;
    final int innerOffset = 1;
    final int finalState = embed(builder, inner, innerOffset);
    final int innerInitial = inner.initial() + innerOffset;

    builder
      .addState(initial)
      .addState(finalState)
      .setInitial(initial)
      .addAccepting(finalState)
      .addEpsilonTransition(initial, innerInitial)
      .addEpsilonTransition(initial, finalState);
    for (int innerFinal : shifted(inner.accepting(), innerOffset)) {
      builder
        .addEpsilonTransition(innerFinal, finalState)
        .addEpsilonTransition(innerFinal, innerInitial);
    }
    return builder.build();
  }

  /**
   * Copy the states, symbols and transitions of a fragment into a builder,
   * renumbering every state by adding {@code offset}.
   *
   * Initial and final markers are not copied - the caller decides those.
   *
   * @param builder where to copy the fragment
   * @param fragment NFA to embed
   * @param offset amount added to every state of the fragment
   * @return first state id above every embedded state
   */
  static int embed(
    Nfa.Builder<Integer, Character> builder,
    Nfa<Integer, Character> fragment,
    int offset
  ) {
    builder.addSymbols(fragment.alphabet());
    int maxState = -1;
    for (int state : fragment.states()) {
      maxState = Math.max(maxState, state);
      builder.addState(state + offset);

      for (var entry : fragment.transitionsFrom(state).entrySet()) {
        for (int target : entry.getValue()) {
          builder.addTransition(state + offset, entry.getKey(), target + offset);
        }
      }
      for (int target : fragment.epsilonTargets(state)) {
        builder.addEpsilonTransition(state + offset, target + offset);
      }
    }
    return maxState + offset + 1;
  }

  private static Set<Integer> shifted(Set<Integer> states, int offset) {
    final var result = new LinkedHashSet<Integer>();
    for (int state : states) {
      result.add(state + offset);
    }
    return Collections.unmodifiableSet(result);
  }
}
