package fsa.graph;

import fsa.util.States;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Transducer over an NFA.
 *
 * The cursor is the set of states the NFA could be in. It starts at the
 * epsilon closure of the initial state and moves over the epsilon-free
 * transitions, so it is always epsilon-closed. Once it is empty it stays
 * empty.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 * @param <V> value associated with states
 */
public final class NfaTransducer<Q, E, V> implements Transducer<E, Set<V>> {

  private final EpsilonFreeTransitions<Q, E> transitions;
  private final Set<Q> accepting;
  private final Map<Q, V> outputs;
  private Set<Q> current;

  NfaTransducer(EpsilonFreeTransitions<Q, E> transitions, Set<Q> accepting, Map<Q, V> outputs) {
    this.transitions = transitions;
    this.accepting = accepting;
    this.outputs = Objects.requireNonNull(outputs, "outputs");
    this.current = transitions.initialClosure();
  }

  @Override
  public Set<V> push(E symbol) {
    if (!current.isEmpty()) {
      current = Collections.unmodifiableSet(transitions.step(current, symbol));
    }
    return output();
  }

  /**
   * Outputs of the current states (states without an output are skipped).
   */
  @Override
  public Set<V> output() {
    final var values = new LinkedHashSet<V>();
    for (Q state : current) {
      final V value = outputs.get(state);
      if (value != null) {
        values.add(value);
      }
    }
    return Collections.unmodifiableSet(values);
  }

  @Override
  public boolean isAccepting() {
    return !Collections.disjoint(current, accepting);
  }

  /**
   * @return current (epsilon-closed) state set
   */
  public Set<Q> current() {
    return current;
  }

  /**
   * Move the cursor back to the closure of the initial state.
   */
  public void reset() {
    current = transitions.initialClosure();
  }

  @Override
  public String toString() {
    return "NfaTransducer(current=" + States.render(current) + ")";
  }
}
