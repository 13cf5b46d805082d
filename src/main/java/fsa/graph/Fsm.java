package fsa.graph;

import java.util.Set;

/**
 * Finite state machine
 *
 * Both kinds of automata are immutable once built, and every derivation out
 * of one (determinization, minimization, epsilon removal) allocates a fresh
 * state space.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public interface Fsm<Q, E> extends DotGraph<Q, String> {

  /**
   * Input symbols.
   *
   * @return alphabet of the machine
   */
  Set<E> alphabet();

  /**
   * All states
   *
   * @return set of all declared states
   */
  Set<Q> states();

  /**
   * Initial state
   *
   * @return starting state in the machine
   */
  Q initial();

  /**
   * Accepting states
   *
   * @return accepting states in the machine
   */
  Set<Q> accepting();

  /**
   * Run the machine over a full input.
   *
   * @param input sequence of symbols
   * @return whether the input is in the language of the machine
   */
  boolean accepts(Iterable<? extends E> input);

  /**
   * View the machine as an NFA (a DFA has single-target transitions and no
   * epsilon edges).
   *
   * @return equivalent NFA over the same states
   */
  Nfa<Q, E> toNfa();
}
