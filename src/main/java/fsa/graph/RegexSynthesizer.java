package fsa.graph;

import fsa.util.States;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regular expression synthesis by state elimination.
 *
 * The automaton is copied into a sparse adjacency map from {@code (from, to)}
 * pairs to regex labels, a fresh start node with an epsilon edge to the
 * initial state and a fresh accept node with epsilon edges from every
 * accepting state are added, and then every original state is eliminated in
 * the order of its rendered text. The label left on the start to accept edge
 * describes the language of the automaton.
 *
 * Labels are regex text. A missing edge is the empty language {@link #EMPTY_SET}
 * and the empty string is {@link #EPSILON}. Unions are always written inside
 * a group, and epsilon is distributed out of concatenations and folded into
 * starred alternatives, so that the output reads back with
 * {@link fsa.parser.RegexParser} whenever the alphabet consists of letters and
 * digits and the language can be written in that grammar at all.
 */
public final class RegexSynthesizer {

  private static final Logger logger = LoggerFactory.getLogger(RegexSynthesizer.class);

  public static final String EMPTY_SET = "∅";
  public static final String EPSILON = "ε";
  public static final String UNION = "|";

  private final boolean simplify;

  /**
   * @param simplify whether to run the textual cleanup pass over the result
   */
  public RegexSynthesizer(boolean simplify) {
    this.simplify = simplify;
  }

  /**
   * Synthesize a simplified regular expression for an automaton.
   *
   * @param fsm NFA or DFA
   * @return regex text, {@link #EMPTY_SET} if the language is empty
   */
  public static String synthesize(Fsm<?, ?> fsm) {
    return new RegexSynthesizer(true).convert(fsm);
  }

  /**
   * Synthesize a regular expression for an automaton.
   *
   * @param fsm NFA or DFA
   * @return regex text, {@link #EMPTY_SET} if the language is empty
   */
  public <Q, E> String convert(Fsm<Q, E> fsm) {
    final Nfa<Q, E> nfa = fsm.toNfa();

    final List<Q> order = States.sorted(nfa.states());
    final Map<Q, Integer> indices = new HashMap<>();
    for (int i = 0; i < order.size(); i++) {
      indices.put(order.get(i), i);
    }
    final int start = order.size();
    final int accept = order.size() + 1;

    final Map<Edge, String> edges = new LinkedHashMap<>();
    merge(edges, new Edge(start, indices.get(nfa.initial())), EPSILON);
    for (Q state : nfa.accepting()) {
      merge(edges, new Edge(indices.get(state), accept), EPSILON);
    }
    for (Q state : order) {
      final int from = indices.get(state);
      for (var entry : nfa.transitionsFrom(state).entrySet()) {
        final String label = String.valueOf(entry.getKey());
        for (Q target : entry.getValue()) {
          merge(edges, new Edge(from, indices.get(target)), label);
        }
      }
      for (Q target : nfa.epsilonTargets(state)) {
        merge(edges, new Edge(from, indices.get(target)), EPSILON);
      }
    }

    for (int removed = 0; removed < order.size(); removed++) {
      eliminate(edges, removed);
    }

    final String raw = edges.getOrDefault(new Edge(start, accept), EMPTY_SET);
    final String result = simplify ? simplify(raw) : raw;
    logger.debug("synthesized {} from {} states", result, order.size());
    return result;
  }

  /**
   * Remove one node, rerouting every path through it.
   *
   * @param edges adjacency map, updated in place
   * @param removed node to eliminate
   */
  private static void eliminate(Map<Edge, String> edges, int removed) {
    final String loop = edges.remove(new Edge(removed, removed));
    final String loopStar = star(loop == null ? EMPTY_SET : loop);

    final List<Map.Entry<Edge, String>> incoming = new ArrayList<>();
    final List<Map.Entry<Edge, String>> outgoing = new ArrayList<>();
    for (var entry : edges.entrySet()) {
      if (entry.getKey().to() == removed) {
        incoming.add(Map.entry(entry.getKey(), entry.getValue()));
      } else if (entry.getKey().from() == removed) {
        outgoing.add(Map.entry(entry.getKey(), entry.getValue()));
      }
    }
    edges.keySet().removeIf(edge -> edge.from() == removed || edge.to() == removed);

    for (var in : incoming) {
      for (var out : outgoing) {
        final String path = concat(concat(in.getValue(), loopStar), out.getValue());
        merge(edges, new Edge(in.getKey().from(), out.getKey().to()), path);
      }
    }
  }

  /**
   * Union a label into an edge, treating a missing edge as the empty language.
   */
  private static void merge(Map<Edge, String> edges, Edge edge, String label) {
    final String merged = union(edges.getOrDefault(edge, EMPTY_SET), label);
    if (EMPTY_SET.equals(merged)) {
      edges.remove(edge);
    } else {
      edges.put(edge, merged);
    }
  }

  static String concat(String lhs, String rhs) {
    if (EMPTY_SET.equals(lhs) || EMPTY_SET.equals(rhs)) {
      return EMPTY_SET;
    } else if (EPSILON.equals(lhs)) {
      return rhs;
    } else if (EPSILON.equals(rhs)) {
      return lhs;
    }

    // The pattern grammar has no epsilon literal, so (ε|x)y is written (y|xy)
    final List<String> lhsAlternatives = alternatives(lhs);
    if (lhsAlternatives.contains(EPSILON)) {
      String distributed = EMPTY_SET;
      for (String alternative : lhsAlternatives) {
        distributed = union(distributed, concat(alternative, rhs));
      }
      return distributed;
    }
    final List<String> rhsAlternatives = alternatives(rhs);
    if (rhsAlternatives.contains(EPSILON)) {
      String distributed = EMPTY_SET;
      for (String alternative : rhsAlternatives) {
        distributed = union(distributed, concat(lhs, alternative));
      }
      return distributed;
    }
    return groupUnion(lhs) + groupUnion(rhs);
  }

  /**
   * Union of two labels, flattened into a single group of distinct
   * alternatives. Epsilon is dropped when another alternative already matches
   * the empty string, or folded into the first alternative of the shape
   * {@code x(yx)*y}, which becomes {@code (xy)*}.
   */
  static String union(String lhs, String rhs) {
    if (EMPTY_SET.equals(lhs)) {
      return rhs;
    } else if (EMPTY_SET.equals(rhs) || lhs.equals(rhs)) {
      return lhs;
    }

    final var distinct = new LinkedHashSet<String>(alternatives(lhs));
    distinct.addAll(alternatives(rhs));
    final List<String> alternatives = new ArrayList<>(distinct);
    if (alternatives.remove(EPSILON) && !absorbEpsilon(alternatives)) {
      alternatives.add(0, EPSILON);
    }
    return alternation(alternatives);
  }

  static String star(String inner) {
    if (EMPTY_SET.equals(inner) || EPSILON.equals(inner)) {
      return EPSILON;
    } else if (isStarredFactor(inner)) {
      return inner;
    }

    // (ε|x)* is x*
    final List<String> alternatives = new ArrayList<>(alternatives(inner));
    if (alternatives.remove(EPSILON)) {
      return star(alternation(alternatives));
    }

    if (inner.length() == 1 || isSingleGroup(inner)) {
      return inner + "*";
    }
    return "(" + inner + ")*";
  }

  /**
   * Whether the label matches the empty string.
   */
  static boolean isNullable(String text) {
    if (EPSILON.equals(text)) {
      return true;
    } else if (hasTopLevelUnion(text)) {
      for (String alternative : splitTopLevel(text)) {
        if (isNullable(alternative)) {
          return true;
        }
      }
      return false;
    }

    final List<String> factors = factors(text);
    if (factors == null) {
      return false;
    }
    for (String factor : factors) {
      if (factor.endsWith("*")) {
        continue;
      } else if (isSingleGroup(factor)) {
        if (!isNullable(factor.substring(1, factor.length() - 1))) {
          return false;
        }
      } else if (!EPSILON.equals(factor)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Make the alternatives of a union match the empty string without an
   * explicit epsilon.
   *
   * @param alternatives alternatives other than epsilon, rewritten in place
   * @return whether epsilon was absorbed
   */
  private static boolean absorbEpsilon(List<String> alternatives) {
    for (String alternative : alternatives) {
      if (isNullable(alternative)) {
        return true;
      }
    }
    for (int i = 0; i < alternatives.size(); i++) {
      final String starred = starredForm(alternatives.get(i));
      if (starred != null) {
        alternatives.set(i, starred);
        return true;
      }
    }
    return false;
  }

  /**
   * Rewrite {@code x(yx)*y} to {@code (xy)*}. With an empty {@code y} or
   * {@code x} this covers {@code rr*} and {@code r*r}.
   *
   * @param text concatenation without a top-level union
   * @return starred text matching the empty string and {@code text}, or
   *         {@code null} if the shape does not match
   */
  private static String starredForm(String text) {
    final List<String> factors = factors(text);
    if (factors == null) {
      return null;
    }
    for (int k = 0; k < factors.size(); k++) {
      final String factor = factors.get(k);
      if (factors.size() == 1 || !isStarredFactor(factor)) {
        continue;
      }
      final String operand = factor.substring(0, factor.length() - 1);
      final String before = String.join("", factors.subList(0, k));
      final String after = String.join("", factors.subList(k + 1, factors.size()));
      if (sameOperand(after + before, operand)) {
        return star(before + after);
      }
    }
    return null;
  }

  private static boolean sameOperand(String text, String operand) {
    return operand.equals(text) || operand.equals("(" + text + ")");
  }

  /**
   * Top-level alternatives of a label, looking through a group that wraps a
   * whole union.
   */
  private static List<String> alternatives(String text) {
    if (isSingleGroup(text) && hasTopLevelUnion(text.substring(1, text.length() - 1))) {
      return alternatives(text.substring(1, text.length() - 1));
    } else if (!hasTopLevelUnion(text)) {
      return List.of(text);
    }
    final List<String> alternatives = new ArrayList<>();
    for (String part : splitTopLevel(text)) {
      alternatives.addAll(alternatives(part));
    }
    return alternatives;
  }

  private static String alternation(List<String> alternatives) {
    if (alternatives.isEmpty()) {
      return EPSILON;
    } else if (alternatives.size() == 1) {
      return alternatives.get(0);
    }
    return "(" + String.join(UNION, alternatives) + ")";
  }

  private static List<String> splitTopLevel(String text) {
    final List<String> parts = new ArrayList<>();
    int depth = 0;
    int partStart = 0;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == '|' && depth == 0) {
        parts.add(text.substring(partStart, i));
        partStart = i + 1;
      }
    }
    parts.add(text.substring(partStart));
    return parts;
  }

  /**
   * Atoms of a concatenation, each with its trailing stars.
   *
   * @return factors, or {@code null} for a union or unbalanced text
   */
  private static List<String> factors(String text) {
    if (hasTopLevelUnion(text)) {
      return null;
    }
    final List<String> factors = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      final int end = factorEnd(text, start);
      if (end < 0) {
        return null;
      }
      int next = end + 1;
      while (next < text.length() && text.charAt(next) == '*') {
        next++;
      }
      factors.add(text.substring(start, next));
      start = next;
    }
    return factors;
  }

  /**
   * Whether the text is exactly one starred atom, like {@code a*} or {@code (ab)*}.
   */
  private static boolean isStarredFactor(String text) {
    return text.length() > 1
      && text.endsWith("*")
      && factorStart(text, text.length() - 2) == 0;
  }

  /**
   * Whether the whole text is one parenthesized group.
   */
  static boolean isSingleGroup(String text) {
    return text.startsWith("(") && factorEnd(text, 0) == text.length() - 1;
  }

  /**
   * Whether the text has a union operator outside of any group.
   */
  static boolean hasTopLevelUnion(String text) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == '|' && depth == 0) {
        return true;
      }
    }
    return false;
  }

  private static String groupUnion(String text) {
    return hasTopLevelUnion(text) ? "(" + text + ")" : text;
  }

  /**
   * Start of the atom ending at {@code end}: the matching open paren for a
   * group, otherwise the position itself.
   *
   * @return start index, or -1 if the parentheses are unbalanced
   */
  private static int factorStart(String text, int end) {
    if (end < 0 || text.charAt(end) != ')') {
      return end;
    }
    int depth = 0;
    for (int i = end; i >= 0; i--) {
      final char c = text.charAt(i);
      if (c == ')') {
        depth++;
      } else if (c == '(' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  /**
   * End of the atom starting at {@code start}: the matching close paren for
   * a group, otherwise the position itself.
   *
   * @return end index, or -1 if the parentheses are unbalanced
   */
  private static int factorEnd(String text, int start) {
    if (start >= text.length() || text.charAt(start) != '(') {
      return start;
    }
    int depth = 0;
    for (int i = start; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Textual cleanup, repeated until nothing changes.
   *
   * Only rewrites which keep the language are applied. An epsilon left inside
   * a union such as {@code (ε|ab)} is kept.
   *
   * @param regex synthesized text
   * @return cleaned up text
   */
  static String simplify(String regex) {
    String previous;
    String current = regex;
    do {
      previous = current;
      current = current
        .replace(EPSILON + "*", EPSILON)
        .replace(EMPTY_SET + "*", EPSILON)
        .replace(EMPTY_SET + UNION, "")
        .replace(UNION + EMPTY_SET, "")
        .replace("()*", "")
        .replace("()", "")
        .replace(UNION + UNION, UNION)
        .replace("(" + UNION, "(")
        .replace(UNION + ")", ")");
      current = collapseDoubledGroups(current);
      if (current.startsWith(UNION)) {
        current = current.substring(1);
      }
      if (current.endsWith(UNION)) {
        current = current.substring(0, current.length() - 1);
      }
    } while (!current.equals(previous));

    if (current.isEmpty()) {
      return EPSILON;
    }
    return current;
  }

  /**
   * Rewrite {@code ((x))} into {@code (x)}.
   */
  private static String collapseDoubledGroups(String text) {
    for (int i = 0; i + 1 < text.length(); i++) {
      if (text.charAt(i) == '(' && text.charAt(i + 1) == '(') {
        final int outerEnd = factorEnd(text, i);
        final int innerEnd = factorEnd(text, i + 1);
        if (outerEnd > 0 && innerEnd == outerEnd - 1) {
          return text.substring(0, i)
            + text.substring(i + 1, outerEnd)
            + text.substring(outerEnd + 1);
        }
      }
    }
    return text;
  }

  /**
   * Key of the adjacency map.
   */
  private record Edge(int from, int to) { }
}
