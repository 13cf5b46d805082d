package fsa.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Closure of states under epsilon (non-consuming) transitions.
 *
 * Closures of single states are memoized, so one instance should be used for
 * the duration of one algorithm over an automaton that does not change.
 *
 * @param <Q> states in the automata
 */
public final class EpsilonClosure<Q> {

  private final Function<Q, Set<Q>> epsilonTargets;
  private final Map<Q, Set<Q>> memoized = new HashMap<>();

  /**
   * @param epsilonTargets targets of the epsilon edges out of a state (empty if none)
   */
  public EpsilonClosure(Function<Q, Set<Q>> epsilonTargets) {
    this.epsilonTargets = epsilonTargets;
  }

  /**
   * Smallest set containing {@code state} and closed under epsilon edges.
   *
   * This is a breadth-first search over epsilon edges only, so it handles
   * epsilon cycles and never recurses.
   *
   * @param state starting state
   * @return unmodifiable closure, in discovery order
   */
  public Set<Q> of(Q state) {
    final Set<Q> cached = memoized.get(state);
    if (cached != null) {
      return cached;
    }

    final var closure = new LinkedHashSet<Q>();
    final var toVisit = new LinkedList<Q>();
    closure.add(state);
    toVisit.addLast(state);

    while (!toVisit.isEmpty()) {
      final Q next = toVisit.removeFirst();
      for (Q target : epsilonTargets.apply(next)) {
        if (closure.add(target)) {
          toVisit.addLast(target);
        }
      }
    }

    final Set<Q> result = Collections.unmodifiableSet(closure);
    memoized.put(state, result);
    return result;
  }

  /**
   * Union of the closures of several states.
   *
   * @param states starting states
   * @return unmodifiable closure (empty if {@code states} is empty)
   */
  public Set<Q> ofAll(Collection<? extends Q> states) {
    final var closure = new LinkedHashSet<Q>();
    for (Q state : states) {
      closure.addAll(of(state));
    }
    return Collections.unmodifiableSet(closure);
  }
}
