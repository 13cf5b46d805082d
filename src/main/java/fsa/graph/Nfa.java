package fsa.graph;

import fsa.parser.Regex;
import fsa.parser.RegexParser;
import fsa.util.States;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Non-deterministic finite state automaton.
 *
 * Symbol transitions map a state and a symbol to a (possibly empty) set of
 * target states. Epsilon transitions are kept in a table of their own, so
 * the epsilon sentinel can never collide with an alphabet symbol.
 *
 * None of the exposed collections are modifiable.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public final class Nfa<Q, E> implements Fsm<Q, E> {

  /**
   * Text used for epsilon edges when rendering.
   */
  public static final String EPSILON_LABEL = "ε";

  private final Set<E> alphabet;
  private final Set<Q> states;
  private final Q initial;
  private final Map<Q, Map<E, Set<Q>>> transitions;
  private final Map<Q, Set<Q>> epsilonTransitions;
  private final Set<Q> accepting;

  private Nfa(
    Set<E> alphabet,
    Set<Q> states,
    Q initial,
    Map<Q, Map<E, Set<Q>>> transitions,
    Map<Q, Set<Q>> epsilonTransitions,
    Set<Q> accepting
  ) {
    this.alphabet = alphabet;
    this.states = states;
    this.initial = initial;
    this.transitions = transitions;
    this.epsilonTransitions = epsilonTransitions;
    this.accepting = accepting;
  }

  /**
   * Build an NFA from a regular expression tree using Thompson's construction.
   *
   * @param regex expression tree
   * @return NFA whose states are small integers
   */
  public static Nfa<Integer, Character> fromRegex(Regex regex) {
    return regex.accept(new ThompsonBuilder());
  }

  /**
   * Parse a pattern straight into an NFA (without an intermediate tree).
   *
   * @param pattern regular expression text
   * @return NFA whose states are small integers
   */
  public static Nfa<Integer, Character> parse(String pattern) throws PatternSyntaxException {
    return RegexParser.parse(new ThompsonBuilder(), pattern);
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
   * Symbol transitions out of a state.
   *
   * @param state state inside the NFA
   * @return map of symbols to their (non-empty) target sets
   */
  public Map<E, Set<Q>> transitionsFrom(Q state) {
    return transitions.getOrDefault(state, Collections.emptyMap());
  }

  /**
   * Look up the targets of a symbol transition.
   *
   * A missing transition is not an error - it just has no targets.
   *
   * @param state source state
   * @param symbol symbol consumed
   * @return target states, empty if there is no such transition
   */
  public Set<Q> targets(Q state, E symbol) {
    return transitionsFrom(state).getOrDefault(symbol, Collections.emptySet());
  }

  /**
   * Targets of the epsilon transitions out of a state.
   *
   * @param state source state
   * @return target states, empty if there are none
   */
  public Set<Q> epsilonTargets(Q state) {
    return epsilonTransitions.getOrDefault(state, Collections.emptySet());
  }

  /**
   * @return whether any state has an outgoing epsilon transition
   */
  public boolean hasEpsilonTransitions() {
    return !epsilonTransitions.isEmpty();
  }

  /**
   * Fresh closure calculator over this NFA's epsilon edges.
   */
  public EpsilonClosure<Q> epsilonClosure() {
    return new EpsilonClosure<>(this::epsilonTargets);
  }

  @Override
  public boolean accepts(Iterable<? extends E> input) {
    final EpsilonClosure<Q> closure = epsilonClosure();
    Set<Q> current = closure.of(initial);

    for (E symbol : input) {
      final var afterSymbol = new HashSet<Q>();
      for (Q state : current) {
        afterSymbol.addAll(targets(state, symbol));
      }
      current = closure.ofAll(afterSymbol);
      if (current.isEmpty()) {
        return false;
      }
    }

    return !Collections.disjoint(current, accepting);
  }

  /**
   * Convert to an equivalent DFA using the subset construction.
   *
   * @return DFA whose states are epsilon-closed sets of states of this NFA
   */
  public Dfa<Set<Q>, E> toDfa() {
    return SubsetConstruction.toDfa(this);
  }

  /**
   * Equivalent NFA with no epsilon transitions.
   *
   * Only states reachable from the initial state are kept. A state is
   * accepting if its epsilon closure contained an accepting state.
   *
   * @return epsilon-free NFA over a subset of the states of this NFA
   */
  public Nfa<Q, E> withoutEpsilon() {
    final var flat = EpsilonFreeTransitions.of(this);
    final var closure = flat.closure();

    final var builder = new Builder<Q, E>()
      .addSymbols(alphabet)
      .addStates(flat.reachable())
      .setInitial(initial);
    for (Q state : flat.reachable()) {
      if (!Collections.disjoint(closure.of(state), accepting)) {
        builder.addAccepting(state);
      }
      for (var entry : flat.transitionsFrom(state).entrySet()) {
        for (Q target : entry.getValue()) {
          builder.addTransition(state, entry.getKey(), target);
        }
      }
    }
    return builder.build();
  }

  /**
   * Transducer over this NFA, emitting whether each current state can accept.
   *
   * @return transducer whose output is a subset of {@code {true, false}}
   */
  public NfaTransducer<Q, E, Boolean> transducer() {
    final var closure = epsilonClosure();
    final var outputs = new LinkedHashMap<Q, Boolean>();
    for (Q state : states) {
      outputs.put(state, !Collections.disjoint(closure.of(state), accepting));
    }
    return transducer(outputs);
  }

  /**
   * Transducer over this NFA with a custom state output.
   *
   * @param outputs output associated with each state
   * @return fresh transducer positioned at the closure of the initial state
   */
  public <V> NfaTransducer<Q, E, V> transducer(Map<Q, V> outputs) {
    return new NfaTransducer<>(EpsilonFreeTransitions.of(this), accepting, outputs);
  }

  /**
   * Replace every state by its rendered text.
   *
   * Useful before rendering or persisting automata whose states are sets.
   *
   * @return isomorphic NFA with string states
   */
  public Nfa<String, E> squash() {
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
        for (Q to : entry.getValue()) {
          builder.addTransition(States.render(from.getKey()), entry.getKey(), States.render(to));
        }
      }
    }
    for (var from : epsilonTransitions.entrySet()) {
      for (Q to : from.getValue()) {
        builder.addEpsilonTransition(States.render(from.getKey()), States.render(to));
      }
    }
    return builder.build();
  }

  @Override
  public Nfa<Q, E> toNfa() {
    return this;
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
    final var symbolEdges = transitions
      .entrySet()
      .stream()
      .flatMap(from -> from
        .getValue()
        .entrySet()
        .stream()
        .flatMap(entry -> entry
          .getValue()
          .stream()
          .map(to -> new DotGraph.Edge<>(from.getKey(), to, String.valueOf(entry.getKey())))
        )
      );
    final var epsilonEdges = epsilonTransitions
      .entrySet()
      .stream()
      .flatMap(from -> from
        .getValue()
        .stream()
        .map(to -> new DotGraph.Edge<>(from.getKey(), to, EPSILON_LABEL))
      );
    return Stream.concat(initialEdge, Stream.concat(symbolEdges, epsilonEdges));
  }

  @Override
  public String toString() {
    return "Nfa(alphabet=" + alphabet
      + ", states=" + States.render(states)
      + ", initial=" + States.render(initial)
      + ", transitions=" + transitions
      + ", epsilon=" + epsilonTransitions
      + ", final=" + States.render(accepting)
      + ")";
  }

  /**
   * Incrementally declares an NFA.
   *
   * States and symbols must be declared before (or after) they are used by
   * transitions; {@link #build} rejects anything undeclared.
   */
  public static final class Builder<Q, E> {

    private boolean used = false;
    private Q initial;
    private final Set<E> alphabet = new LinkedHashSet<>();
    private final Set<Q> states = new LinkedHashSet<>();
    private final Set<Q> accepting = new LinkedHashSet<>();
    private final Map<Q, Map<E, Set<Q>>> transitions = new LinkedHashMap<>();
    private final Map<Q, Set<Q>> epsilonTransitions = new LinkedHashMap<>();

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

    public Builder<Q, E> addTransition(Q from, E symbol, Q to) {
      transitions
        .computeIfAbsent(from, k -> new LinkedHashMap<>())
        .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
        .add(to);
      return this;
    }

    public Builder<Q, E> addEpsilonTransition(Q from, Q to) {
      epsilonTransitions
        .computeIfAbsent(from, k -> new LinkedHashSet<>())
        .add(to);
      return this;
    }

    /**
     * Check the invariants and freeze the NFA.
     *
     * @return immutable NFA
     * @throws InvalidAutomatonException if a state or symbol is undeclared
     */
    public Nfa<Q, E> build() {
      if (used) {
        throw new IllegalStateException("build may only be called once on an NFA builder");
      } else {
        used = true;
      }

      Invariants.requireState(states, initial, Invariants.INITIAL_DECLARED);
      for (Q state : accepting) {
        Invariants.requireState(states, state, Invariants.FINAL_DECLARED);
      }

      final var frozenTransitions = new LinkedHashMap<Q, Map<E, Set<Q>>>();
      for (var from : transitions.entrySet()) {
        Invariants.requireState(states, from.getKey(), Invariants.SOURCE_DECLARED);
        final var perSymbol = new LinkedHashMap<E, Set<Q>>();
        for (var entry : from.getValue().entrySet()) {
          Invariants.requireSymbol(alphabet, entry.getKey());
          for (Q to : entry.getValue()) {
            Invariants.requireState(states, to, Invariants.TARGET_DECLARED);
          }
          perSymbol.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        frozenTransitions.put(from.getKey(), Collections.unmodifiableMap(perSymbol));
      }

      final var frozenEpsilon = new LinkedHashMap<Q, Set<Q>>();
      for (var from : epsilonTransitions.entrySet()) {
        Invariants.requireState(states, from.getKey(), Invariants.SOURCE_DECLARED);
        for (Q to : from.getValue()) {
          Invariants.requireState(states, to, Invariants.TARGET_DECLARED);
        }
        frozenEpsilon.put(from.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(from.getValue())));
      }

      return new Nfa<>(
        Collections.unmodifiableSet(new LinkedHashSet<>(alphabet)),
        Collections.unmodifiableSet(new LinkedHashSet<>(states)),
        initial,
        Collections.unmodifiableMap(frozenTransitions),
        Collections.unmodifiableMap(frozenEpsilon),
        Collections.unmodifiableSet(new LinkedHashSet<>(accepting))
      );
    }
  }
}
