package fsa.graph;

import fsa.util.States;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Deterministic finite automata
 *
 * The transition function is partial: a missing entry means there is no
 * transition, and running into one rejects the input.
 *
 * None of the exposed collections are modifiable.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public final class Dfa<Q, E> implements Fsm<Q, E> {

  private final Set<E> alphabet;
  private final Set<Q> states;
  private final Q initial;
  private final Map<Q, Map<E, Q>> transitions;
  private final Set<Q> accepting;

  private Dfa(
    Set<E> alphabet,
    Set<Q> states,
    Q initial,
    Map<Q, Map<E, Q>> transitions,
    Set<Q> accepting
  ) {
    this.alphabet = alphabet;
    this.states = states;
    this.initial = initial;
    this.transitions = transitions;
    this.accepting = accepting;
  }

  @Override
  public Set<E> alphabet() {
    return alphabet;
  }

  @Override
  public Set<Q> states() {
    return states;
  }

  @Override
  public Q initial() {
    return initial;
  }

  @Override
  public Set<Q> accepting() {
    return accepting;
  }

  /**
   * Look up the mapping of transitions from a certain state
   *
   * @param state state inside the DFA
   * @return map of alphabet symbols to target states
   */
  public Map<E, Q> transitionsFrom(Q state) {
    return transitions.getOrDefault(state, Collections.emptyMap());
  }

  /**
   * Follow one transition.
   *
   * @param state source state
   * @param symbol symbol consumed
   * @return target state, or empty if there is no such transition
   */
  public Optional<Q> step(Q state, E symbol) {
    return Optional.ofNullable(transitionsFrom(state).get(symbol));
  }

  @Override
  public boolean accepts(Iterable<? extends E> input) {
    Q current = initial;
    for (E symbol : input) {
      current = transitionsFrom(current).get(symbol);

      // No transition found
      if (current == null) {
        return false;
      }
    }
    return accepting.contains(current);
  }

  /**
   * Equivalent DFA with the fewest states.
   *
   * @see DfaMinimizer#minimize
   */
  public Dfa<Set<Q>, E> minimized() {
    return DfaMinimizer.minimize(this);
  }

  /**
   * Transducer emitting whether the current state is accepting.
   *
   * Once the transducer falls off the transition function its output is
   * empty.
   */
  public DfaTransducer<Q, E, Boolean> transducer() {
    final var outputs = new LinkedHashMap<Q, Boolean>();
    for (Q state : states) {
      outputs.put(state, accepting.contains(state));
    }
    return transducer(outputs, null);
  }

  /**
   * Transducer over this DFA with a custom state output.
   *
   * @param outputs output associated with each state
   * @param deadOutput output once there is no current state ({@code null} for none)
   * @return fresh transducer positioned at the initial state
   */
  public <V> DfaTransducer<Q, E, V> transducer(Map<Q, V> outputs, V deadOutput) {
    return new DfaTransducer<>(this, outputs, deadOutput);
  }

  /**
   * Replace every state by its rendered text.
   *
   * @return isomorphic DFA with string states
   */
  public Dfa<String, E> squash() {
    final var builder = new Builder<String, E>()
      .addSymbols(alphabet)
      .setInitial(States.render(initial));
    for (Q state : states) {
      builder.addState(States.render(state));
    }
    for (Q state : accepting) {
      builder.addAccepting(States.render(state));
    }
    for (var from : transitions.entrySet()) {
      for (var entry : from.getValue().entrySet()) {
        builder.addTransition(States.render(from.getKey()), entry.getKey(), States.render(entry.getValue()));
      }
    }
    return builder.build();
  }

  @Override
  public Nfa<Q, E> toNfa() {
    final var builder = new Nfa.Builder<Q, E>()
      .addSymbols(alphabet)
      .addStates(states)
      .setInitial(initial);
    for (Q state : accepting) {
      builder.addAccepting(state);
    }
    for (var from : transitions.entrySet()) {
      for (var entry : from.getValue().entrySet()) {
        builder.addTransition(from.getKey(), entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  @Override
  public Stream<DotGraph.Vertex<Q>> vertices() {
    return states
      .stream()
      .map(state -> new DotGraph.Vertex<Q>(state, accepting.contains(state)));
  }

  @Override
  public Stream<DotGraph.Edge<Q, String>> edges() {
    final var initialEdge = Stream.of(new DotGraph.Edge<Q, String>(null, initial, null));
    final var innerEdges = transitions
      .entrySet()
      .stream()
      .flatMap(from -> from
        .getValue()
        .entrySet()
        .stream()
        .map(entry -> new DotGraph.Edge<>(from.getKey(), entry.getValue(), String.valueOf(entry.getKey())))
      );
    return Stream.concat(initialEdge, innerEdges);
  }

  @Override
  public String toString() {
    return "Dfa(alphabet=" + alphabet
      + ", states=" + States.render(states)
      + ", initial=" + States.render(initial)
      + ", transitions=" + transitions
      + ", final=" + States.render(accepting)
      + ")";
  }

  /**
   * Incrementally declares a DFA.
   *
   * Adding a second, different target for the same state and symbol is
   * rejected straight away.
   */
  public static final class Builder<Q, E> {

    private boolean used = false;
    private Q initial;
    private final Set<E> alphabet = new LinkedHashSet<>();
    private final Set<Q> states = new LinkedHashSet<>();
    private final Set<Q> accepting = new LinkedHashSet<>();
    private final Map<Q, Map<E, Q>> transitions = new LinkedHashMap<>();

    public Builder<Q, E> addSymbol(E symbol) {
      alphabet.add(symbol);
      return this;
    }

    public Builder<Q, E> addSymbols(Iterable<? extends E> symbols) {
      symbols.forEach(alphabet::add);
      return this;
    }

    public Builder<Q, E> addState(Q state) {
      states.add(state);
      return this;
    }

    public Builder<Q, E> addStates(Iterable<? extends Q> newStates) {
      newStates.forEach(states::add);
      return this;
    }

    public Builder<Q, E> setInitial(Q state) {
      initial = state;
      return this;
    }

    public Builder<Q, E> addAccepting(Q state) {
      accepting.add(state);
      return this;
    }

    /**
     * @throws InvalidAutomatonException if the state already moves elsewhere on this symbol
     */
    public Builder<Q, E> addTransition(Q from, E symbol, Q to) {
      final Q previous = transitions
        .computeIfAbsent(from, k -> new LinkedHashMap<>())
        .putIfAbsent(symbol, to);
      if (previous != null && !Objects.equals(previous, to)) {
        throw new InvalidAutomatonException(
          Invariants.FUNCTIONAL,
          "(" + States.render(from) + ", " + symbol + ") maps to both "
            + States.render(previous) + " and " + States.render(to)
        );
      }
      return this;
    }

    /**
     * Check the invariants and freeze the DFA.
     *
     * @return immutable DFA
     * @throws InvalidAutomatonException if a state or symbol is undeclared
     */
    public Dfa<Q, E> build() {
      if (used) {
        throw new IllegalStateException("build may only be called once on a DFA builder");
      } else {
        used = true;
      }

      Invariants.requireState(states, initial, Invariants.INITIAL_DECLARED);
      for (Q state : accepting) {
        Invariants.requireState(states, state, Invariants.FINAL_DECLARED);
      }

      final var frozenTransitions = new LinkedHashMap<Q, Map<E, Q>>();
      for (var from : transitions.entrySet()) {
        Invariants.requireState(states, from.getKey(), Invariants.SOURCE_DECLARED);
        for (var entry : from.getValue().entrySet()) {
          Invariants.requireSymbol(alphabet, entry.getKey());
          Invariants.requireState(states, entry.getValue(), Invariants.TARGET_DECLARED);
        }
        frozenTransitions.put(from.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(from.getValue())));
      }

      return new Dfa<>(
        Collections.unmodifiableSet(new LinkedHashSet<>(alphabet)),
        Collections.unmodifiableSet(new LinkedHashSet<>(states)),
        initial,
        Collections.unmodifiableMap(frozenTransitions),
        Collections.unmodifiableSet(new LinkedHashSet<>(accepting))
      );
    }
  }
}
