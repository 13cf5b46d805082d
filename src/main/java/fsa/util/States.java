package fsa.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rendering and ordering of opaque state identifiers.
 *
 * States produced by subset construction and minimization are sets (of sets)
 * of the original states. Their rendering sorts members so that equal sets
 * always render the same way, which in turn gives every algorithm a
 * deterministic state order.
 */
public final class States {

  /**
   * Orders states by their rendered text.
   */
  public static final Comparator<Object> BY_RENDERING = Comparator.comparing(States::render);

  private States() { }

  /**
   * Render a state as text.
   *
   * Collections render as {@code {a,b,c}} with members sorted by their own
   * rendering; anything else uses {@code toString}.
   *
   * @param state state to render
   * @return text for the state
   */
  public static String render(Object state) {
    if (state instanceof Collection<?> members) {
      return members
        .stream()
        .map(States::render)
        .sorted()
        .collect(Collectors.joining(",", "{", "}"));
    }
    return String.valueOf(state);
  }

  /**
   * Copy states into a list in rendering order.
   *
   * @param states states to sort
   * @return new sorted list
   */
  public static <Q> List<Q> sorted(Collection<Q> states) {
    final var list = new ArrayList<Q>(states);
    list.sort(BY_RENDERING);
    return list;
  }
}
