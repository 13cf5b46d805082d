package fsa.graph;

/**
 * Incremental run of an automaton (a Moore machine).
 *
 * Symbols are consumed one at a time. After every symbol the output of the
 * current configuration and whether it accepts can be queried, so the
 * transducer is not tied to a fixed end of input.
 *
 * Instances are mutable and not thread-safe.
 *
 * @param <E> input symbol alphabet
 * @param <O> output after each symbol
 */
public interface Transducer<E, O> {

  /**
   * Consume one symbol.
   *
   * @param symbol next input symbol
   * @return output of the configuration reached
   */
  O push(E symbol);

  /**
   * @return output of the current configuration
   */
  O output();

  /**
   * @return whether the symbols consumed so far are accepted
   */
  boolean isAccepting();

  /**
   * Consume several symbols.
   *
   * @param symbols input symbols, in order
   * @return output of the configuration reached after the last symbol
   */
  default O pushAll(Iterable<? extends E> symbols) {
    for (E symbol : symbols) {
      push(symbol);
    }
    return output();
  }
}
