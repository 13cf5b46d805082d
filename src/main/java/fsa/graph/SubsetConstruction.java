package fsa.graph;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Powerset construction of a DFA from an NFA.
 *
 * The NFA is first flattened (see {@link EpsilonFreeTransitions}), so every
 * DFA state is an epsilon-closed set of NFA states. Only non-empty sets are
 * ever registered, so the resulting DFA has no explicit dead state and its
 * transition function may be partial.
 */
public final class SubsetConstruction {

  private static final Logger logger = LoggerFactory.getLogger(SubsetConstruction.class);

  private SubsetConstruction() { }

  /**
   * Convert an NFA into an equivalent DFA.
   *
   * DFA states are discovered breadth-first from the closure of the initial
   * state, which bounds the work by the reachable part of the powerset.
   *
   * @param nfa input automaton
   * @return DFA over sets of NFA states
   */
  public static <Q, E> Dfa<Set<Q>, E> toDfa(Nfa<Q, E> nfa) {
    final var flat = EpsilonFreeTransitions.of(nfa);
    final Set<Q> initial = flat.initialClosure();

    final var builder = new Dfa.Builder<Set<Q>, E>()
      .addSymbols(nfa.alphabet())
      .addState(initial)
      .setInitial(initial);

    final var seenStates = new HashSet<Set<Q>>();
    final var toVisit = new LinkedList<Set<Q>>();
    seenStates.add(initial);
    toVisit.addLast(initial);

    while (!toVisit.isEmpty()) {
      final Set<Q> current = toVisit.removeFirst();

      // Composites are epsilon-closed, so meeting a final state is enough
      if (!Collections.disjoint(current, nfa.accepting())) {
        builder.addAccepting(current);
      }

      for (E symbol : nfa.alphabet()) {
        final Set<Q> next = Collections.unmodifiableSet(flat.step(current, symbol));
        if (next.isEmpty()) {
          continue;
        }
        if (seenStates.add(next)) {
          builder.addState(next);
          toVisit.addLast(next);
        }
        builder.addTransition(current, symbol, next);
      }
    }

    logger.debug(
      "subset construction produced {} DFA states from {} NFA states",
      seenStates.size(),
      nfa.states().size()
    );
    return builder.build();
  }
}
