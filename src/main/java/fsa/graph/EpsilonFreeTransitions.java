package fsa.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;

/**
 * Transition function of an NFA with its epsilon transitions flattened away.
 *
 * For every state {@code q} and symbol {@code a}, the flattened targets are
 * the closure of everything reachable on {@code a} from the closure of
 * {@code q}. Entries whose source is unreachable from the initial state (in
 * the flattened graph) are culled.
 *
 * Every target set is epsilon-closed.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
final class EpsilonFreeTransitions<Q, E> {

  private final EpsilonClosure<Q> closure;
  private final Set<Q> initialClosure;
  private final Set<Q> reachable;
  private final Map<Q, Map<E, Set<Q>>> transitions;

  private EpsilonFreeTransitions(
    EpsilonClosure<Q> closure,
    Set<Q> initialClosure,
    Set<Q> reachable,
    Map<Q, Map<E, Set<Q>>> transitions
  ) {
    this.closure = closure;
    this.initialClosure = initialClosure;
    this.reachable = reachable;
    this.transitions = transitions;
  }

  static <Q, E> EpsilonFreeTransitions<Q, E> of(Nfa<Q, E> nfa) {
    final EpsilonClosure<Q> closure = nfa.epsilonClosure();

    // Flatten every state, reachable or not
    final Map<Q, Map<E, Set<Q>>> flattened = new LinkedHashMap<>();
    for (Q state : nfa.states()) {
      final Set<Q> stateClosure = closure.of(state);
      for (E symbol : nfa.alphabet()) {
        final var afterSymbol = new LinkedHashSet<Q>();
        for (Q member : stateClosure) {
          afterSymbol.addAll(nfa.targets(member, symbol));
        }
        final Set<Q> targets = closure.ofAll(afterSymbol);
        if (!targets.isEmpty()) {
          flattened
            .computeIfAbsent(state, k -> new LinkedHashMap<>())
            .put(symbol, targets);
        }
      }
    }

    // Breadth-first search for the states reachable over flattened edges
    final var reachable = new LinkedHashSet<Q>();
    final var toVisit = new LinkedList<Q>();
    reachable.add(nfa.initial());
    toVisit.addLast(nfa.initial());
    while (!toVisit.isEmpty()) {
      final Q next = toVisit.removeFirst();
      for (Set<Q> targets : flattened.getOrDefault(next, Collections.emptyMap()).values()) {
        for (Q target : targets) {
          if (reachable.add(target)) {
            toVisit.addLast(target);
          }
        }
      }
    }

    flattened.keySet().retainAll(reachable);
    flattened.replaceAll((state, perSymbol) -> Collections.unmodifiableMap(perSymbol));

    return new EpsilonFreeTransitions<>(
      closure,
      closure.of(nfa.initial()),
      Collections.unmodifiableSet(reachable),
      Collections.unmodifiableMap(flattened)
    );
  }

  /**
   * Closure calculator used during flattening (already warm for every state).
   */
  EpsilonClosure<Q> closure() {
    return closure;
  }

  /**
   * Closure of the initial state of the NFA.
   */
  Set<Q> initialClosure() {
    return initialClosure;
  }

  /**
   * States reachable from the initial state over flattened edges, including
   * the initial state itself.
   */
  Set<Q> reachable() {
    return reachable;
  }

  Map<E, Set<Q>> transitionsFrom(Q state) {
    return transitions.getOrDefault(state, Collections.emptyMap());
  }

  /**
   * Flattened targets, empty if there are none (or the source was culled).
   */
  Set<Q> targets(Q state, E symbol) {
    return transitionsFrom(state).getOrDefault(symbol, Collections.emptySet());
  }

  /**
   * Union of the flattened targets of every member of a state set.
   *
   * @param states source states
   * @param symbol symbol consumed
   * @return union of targets (epsilon-closed)
   */
  Set<Q> step(Set<Q> states, E symbol) {
    final var union = new LinkedHashSet<Q>();
    for (Q state : states) {
      union.addAll(targets(state, symbol));
    }
    return union;
  }
}
