package fsa.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Exhaustive inputs for comparing automata.
 */
public final class Words {

  private Words() { }

  /**
   * Every word over an alphabet, shortest first.
   *
   * @param alphabet symbols to draw from
   * @param maxLength longest word generated
   * @return all words of length {@code 0 .. maxLength}
   */
  public static <E> List<List<E>> upTo(Collection<E> alphabet, int maxLength) {
    final List<List<E>> words = new ArrayList<>();
    List<List<E>> previous = List.of(Collections.emptyList());
    words.addAll(previous);

    for (int length = 1; length <= maxLength; length++) {
      final List<List<E>> next = new ArrayList<>();
      for (List<E> prefix : previous) {
        for (E symbol : alphabet) {
          final List<E> word = new ArrayList<>(prefix);
          word.add(symbol);
          next.add(word);
        }
      }
      words.addAll(next);
      previous = next;
    }
    return words;
  }
}
