package fsa.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for feeding text to automata over {@code Character} alphabets.
 */
public final class Symbols {

  private Symbols() { }

  /**
   * Split a string into its characters.
   *
   * @param input text to split
   * @return one symbol per character
   */
  public static List<Character> chars(String input) {
    return input
      .chars()
      .mapToObj(c -> (char) c)
      .collect(Collectors.toList());
  }
}
