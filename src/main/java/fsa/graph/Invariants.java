package fsa.graph;

import fsa.util.States;
import java.util.Set;

/**
 * Construction-time checks shared by {@link Nfa} and {@link Dfa}.
 */
final class Invariants {

  static final String INITIAL_DECLARED = "initial state must be one of the states";
  static final String FINAL_DECLARED = "final states must be a subset of the states";
  static final String SOURCE_DECLARED = "transition source must be one of the states";
  static final String TARGET_DECLARED = "transition target must be one of the states";
  static final String SYMBOL_DECLARED = "transition symbol must be in the alphabet";
  static final String FUNCTIONAL = "DFA transitions must be functional";

  private Invariants() { }

  static <Q> void requireState(Set<Q> states, Q state, String invariant) {
    if (state == null || !states.contains(state)) {
      throw new InvalidAutomatonException(invariant, "found " + States.render(state));
    }
  }

  static <E> void requireSymbol(Set<E> alphabet, E symbol) {
    if (symbol == null || !alphabet.contains(symbol)) {
      throw new InvalidAutomatonException(SYMBOL_DECLARED, "found " + symbol);
    }
  }
}
