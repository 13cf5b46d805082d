package fsa.parser;

/**
 * Bottom-up traversal of the regular expression pattern AST.
 *
 * @param <R> output from traversing the regex pattern AST
 */
public interface RegexVisitor<R> {

  /**
   * Matches exactly one symbol.
   *
   * @param symbol letter or digit in the pattern
   */
  R visitLiteral(char symbol);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two patterns.
   *
   * @param lhs first alternative
   * @param rhs second alternative
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   *
   * @param inner pattern to repeat
   */
  R visitKleene(R inner);
}
