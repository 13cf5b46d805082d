package fsa.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization.
 *
 * Two reachable states end up in the same class exactly when they agree on
 * finality and, for every symbol, either both lack a transition or both move
 * into the same class. A transition defined for only one of two states
 * distinguishes them, so a state which merely lacks transitions is never
 * merged with a reachable trap state.
 *
 * The partition is computed with a variant of Hopcroft's algorithm. The DFA
 * is first completed with a private sink standing for "no transition"; the
 * sink starts out in a block of its own, so it can never be merged with a
 * real state and its block is discarded at the end.
 */
public final class DfaMinimizer {

  private static final Logger logger = LoggerFactory.getLogger(DfaMinimizer.class);

  private DfaMinimizer() { }

  /**
   * Minimize a DFA.
   *
   * @param dfa input automaton
   * @return equivalent DFA whose states are classes of reachable input states
   */
  public static <Q, E> Dfa<Set<Q>, E> minimize(Dfa<Q, E> dfa) {
    final List<Q> reachable = reachableStates(dfa);
    final List<E> symbols = new ArrayList<>(dfa.alphabet());

    final Map<Q, Integer> indices = new HashMap<>();
    for (int i = 0; i < reachable.size(); i++) {
      indices.put(reachable.get(i), i);
    }

    final Set<SortedSet<Integer>> partition = minimizedPartition(dfa, reachable, indices, symbols);

    // Order the classes by their smallest member so that the output is stable
    final var blocks = new ArrayList<SortedSet<Integer>>(partition);
    blocks.sort((a, b) -> Integer.compare(a.first(), b.first()));

    final Map<Q, Set<Q>> classOf = new HashMap<>();
    for (SortedSet<Integer> block : blocks) {
      final var members = new LinkedHashSet<Q>();
      for (int index : block) {
        members.add(reachable.get(index));
      }
      final Set<Q> equivalenceClass = Collections.unmodifiableSet(members);
      for (Q member : equivalenceClass) {
        classOf.put(member, equivalenceClass);
      }
    }

    final var builder = new Dfa.Builder<Set<Q>, E>()
      .addSymbols(dfa.alphabet())
      .setInitial(classOf.get(dfa.initial()));
    for (Q state : reachable) {
      final Set<Q> from = classOf.get(state);
      builder.addState(from);
      if (dfa.accepting().contains(state)) {
        builder.addAccepting(from);
      }
      for (var entry : dfa.transitionsFrom(state).entrySet()) {
        builder.addTransition(from, entry.getKey(), classOf.get(entry.getValue()));
      }
    }

    logger.debug(
      "minimized DFA from {} states ({} reachable) to {} states",
      dfa.states().size(),
      reachable.size(),
      blocks.size()
    );
    return builder.build();
  }

  /**
   * States reachable from the initial state, in breadth-first order.
   *
   * @param dfa automaton to explore
   * @return reachable states, starting with the initial state
   */
  static <Q, E> List<Q> reachableStates(Dfa<Q, E> dfa) {
    final var seenStates = new LinkedHashSet<Q>();
    final var toVisit = new LinkedList<Q>();
    seenStates.add(dfa.initial());
    toVisit.addLast(dfa.initial());

    while (!toVisit.isEmpty()) {
      final Q next = toVisit.removeFirst();
      for (Q target : dfa.transitionsFrom(next).values()) {
        if (seenStates.add(target)) {
          toVisit.addLast(target);
        }
      }
    }

    return new ArrayList<>(seenStates);
  }

  /**
   * Coarsest partition of the reachable states (by index).
   *
   * @param dfa automaton being minimized
   * @param reachable reachable states, indexed by position
   * @param indices inverse of {@code reachable}
   * @param symbols alphabet, indexed by position
   * @return partition of {@code 0 .. reachable.size() - 1}
   */
  private static <Q, E> Set<SortedSet<Integer>> minimizedPartition(
    Dfa<Q, E> dfa,
    List<Q> reachable,
    Map<Q, Integer> indices,
    List<E> symbols
  ) {
    final int sink = reachable.size();

    // For every symbol, mapping from target states to source states
    final List<Map<Integer, Set<Integer>>> reversedTransitions = new ArrayList<>();
    for (int symbolIndex = 0; symbolIndex < symbols.size(); symbolIndex++) {
      final E symbol = symbols.get(symbolIndex);
      final Map<Integer, Set<Integer>> reversed = new HashMap<>();
      for (int from = 0; from <= sink; from++) {
        final int to = from == sink
          ? sink
          : dfa.step(reachable.get(from), symbol).map(indices::get).orElse(sink);
        reversed.computeIfAbsent(to, k -> new HashSet<>()).add(from);
      }
      reversedTransitions.add(reversed);
    }

    // Set up initial partition: accepting, non-accepting, and the sink alone
    final var accepting = new TreeSet<Integer>();
    final var rejecting = new TreeSet<Integer>();
    for (int state = 0; state < sink; state++) {
      if (dfa.accepting().contains(reachable.get(state))) {
        accepting.add(state);
      } else {
        rejecting.add(state);
      }
    }
    final var partition = new HashSet<SortedSet<Integer>>();
    partition.add(accepting);
    partition.add(rejecting);
    partition.add(new TreeSet<>(Set.of(sink)));
    partition.removeIf(Set::isEmpty);

    // Mapping from states to power states in the partition
    final var stateToPartition = new HashMap<Integer, SortedSet<Integer>>();
    for (final var powerState : partition) {
      for (final var state : powerState) {
        stateToPartition.put(state, powerState);
      }
    }

    // Worklist
    final var toVisit = new HashSet<SortedSet<Integer>>(partition);

    while (!toVisit.isEmpty()) {
      final var powerState = toVisit.iterator().next();
      toVisit.remove(powerState);

      for (final Map<Integer, Set<Integer>> reversed : reversedTransitions) {

        // Pre-image of this power state under one symbol
        final var targetSubset = new HashSet<Integer>();
        for (final int state : powerState) {
          targetSubset.addAll(reversed.getOrDefault(state, Collections.emptySet()));
        }

        // Figure out which pre-images require some refinement of partition sets
        for (final int containedState : targetSubset) {
          final var oldPowerSet = stateToPartition.get(containedState);

          final var inTargetSubset = new TreeSet<Integer>();
          final var notInTargetSubset = new TreeSet<Integer>();
          for (final int state : oldPowerSet) {
            if (targetSubset.contains(state)) {
              inTargetSubset.add(state);
            } else {
              notInTargetSubset.add(state);
            }
          }

          // Skip to the next powerset if not refinement of `oldPowerSet` needed
          if (notInTargetSubset.isEmpty()) {
            continue;
          }

          // Update partition
          partition.remove(oldPowerSet);
          partition.add(inTargetSubset);
          partition.add(notInTargetSubset);

          // Update stateToPartition
          for (final int state : inTargetSubset) {
            stateToPartition.put(state, inTargetSubset);
          }
          for (final int state : notInTargetSubset) {
            stateToPartition.put(state, notInTargetSubset);
          }

          // Update worklist
          if (toVisit.remove(oldPowerSet)) {
            toVisit.add(inTargetSubset);
            toVisit.add(notInTargetSubset);
          } else if (inTargetSubset.size() < notInTargetSubset.size()) {
            toVisit.add(inTargetSubset);
          } else {
            toVisit.add(notInTargetSubset);
          }
        }
      }
    }

    partition.remove(stateToPartition.get(sink));
    return partition;
  }
}
