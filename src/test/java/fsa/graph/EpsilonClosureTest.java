package fsa.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class EpsilonClosureTest {

  @Test
  public void closureOfKleeneStarEntry() {
    final var closure = Nfa.parse("a*").epsilonClosure();
    assertThat(closure.of(0), containsInAnyOrder(0, 1, 3));
    assertThat(closure.of(2), containsInAnyOrder(1, 2, 3));
    assertThat(closure.of(1), containsInAnyOrder(1));
  }

  @Test
  public void closureFollowsCycles() {
    final Map<String, Set<String>> edges = Map.of(
      "p", Set.of("q"),
      "q", Set.of("r", "p"),
      "r", Set.of("q")
    );
    final var closure = new EpsilonClosure<String>(state -> edges.getOrDefault(state, Set.of()));
    assertThat(closure.of("p"), containsInAnyOrder("p", "q", "r"));
    assertThat(closure.of("s"), containsInAnyOrder("s"));
  }

  @Test
  public void closureOfNothingIsEmpty() {
    final var closure = Nfa.parse("a|b").epsilonClosure();
    assertThat(closure.ofAll(List.of()), empty());
  }

  @Test
  public void closureIsIdempotent() {
    for (String pattern : new String[] { "a*", "(a|b)*abb", "(a*b*)*", "a(b|c*)*|d" }) {
      final var nfa = Nfa.parse(pattern);
      final var closure = nfa.epsilonClosure();
      for (Integer state : nfa.states()) {
        final Set<Integer> once = closure.of(state);
        assertThat(pattern + " from " + state, closure.ofAll(once), equalTo(once));
      }
      final Set<Integer> all = closure.ofAll(nfa.states());
      assertThat(pattern, closure.ofAll(all), equalTo(all));
    }
  }

  @Test
  public void closureOfSeveralStatesIsTheUnion() {
    final var closure = Nfa.parse("a|b").epsilonClosure();
    assertThat(closure.ofAll(List.of(2, 4)), containsInAnyOrder(2, 4, 5));
  }
}
