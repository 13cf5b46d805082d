package fsa.graph;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transducer over a DFA.
 *
 * The cursor is the current state. Pushing a symbol with no transition out
 * of the current state leaves the transducer without a state, and it stays
 * there for every later push.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 * @param <V> value associated with states
 */
public final class DfaTransducer<Q, E, V> implements Transducer<E, Optional<V>> {

  private final Dfa<Q, E> dfa;
  private final Map<Q, V> outputs;
  private final V deadOutput;
  private Optional<Q> current;

  /**
   * @param dfa automaton to run
   * @param outputs output of each state (unmapped states output nothing)
   * @param deadOutput output once there is no current state, or {@code null}
   */
  public DfaTransducer(Dfa<Q, E> dfa, Map<Q, V> outputs, V deadOutput) {
    this.dfa = Objects.requireNonNull(dfa, "dfa");
    this.outputs = Objects.requireNonNull(outputs, "outputs");
    this.deadOutput = deadOutput;
    this.current = Optional.of(dfa.initial());
  }

  @Override
  public Optional<V> push(E symbol) {
    current = current.flatMap(state -> dfa.step(state, symbol));
    return output();
  }

  @Override
  public Optional<V> output() {
    return current.isPresent()
      ? Optional.ofNullable(outputs.get(current.get()))
      : Optional.ofNullable(deadOutput);
  }

  @Override
  public boolean isAccepting() {
    return current.isPresent() && dfa.accepting().contains(current.get());
  }

  /**
   * @return current state, empty once a transition was missing
   */
  public Optional<Q> current() {
    return current;
  }

  /**
   * @return whether a missing transition was hit
   */
  public boolean isDead() {
    return current.isEmpty();
  }

  /**
   * Move the cursor back to the initial state.
   */
  public void reset() {
    current = Optional.of(dfa.initial());
  }
}
