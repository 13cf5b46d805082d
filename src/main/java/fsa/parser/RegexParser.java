package fsa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Parser for a small regular expression grammar.
 *
 * <pre>
 *   expression := term ('|' term)*
 *   term       := factor+
 *   factor     := atom '*'?
 *   atom       := literal | '(' expression ')'
 * </pre>
 *
 * A literal is a single letter or digit. This is a fairly standard recursive
 * descent parser whose results are made available through a visitor instead
 * of as an explicit AST type. There is no error recovery: the first error
 * aborts the parse.
 */
public final class RegexParser<A> {

  // Used when "visiting" the AST bottom up
  final private RegexVisitor<A> visitor;

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  /**
   * Parse a regular expression pattern from an input string.
   *
   * The regex visitor can be used to either process the AST incrementally or
   * else build up an explicit AST.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression pattern
   * @return parsed regular expression
   */
  public static <B> B parse(
    RegexVisitor<B> visitor,
    String input
  ) throws PatternSyntaxException {
    final var parser = new RegexParser<B>(visitor, input);
    final B parsed = parser.parseAlternation();

    if (parser.position < parser.length) {
      throw parser.error("Expected the end of the regular expression");
    }
    return parsed;
  }

  private RegexParser(RegexVisitor<A> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(String unsupported) {
    return new UnsupportedPatternSyntaxException(unsupported, input, position);
  }

  /**
   * Peek the next character in the input without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  int peekChar() {
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Get the next character from the input advancing the position.
   *
   * @return next character
   */
  char nextChar() {
    return input.charAt(position++);
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Parse an alternation.
   */
  private A parseAlternation() throws PatternSyntaxException {
    A unionLhs = parseConcatenation();
    while (nextCharIf('|')) {
      A unionRhs = parseConcatenation();
      unionLhs = visitor.visitAlternation(unionLhs, unionRhs);
    }
    return unionLhs;
  }

  /**
   * Parse a concatenation of at least one factor.
   */
  private A parseConcatenation() throws PatternSyntaxException {
    A concatLhs = parseQuantified();

    // Keep parsing concatenations until a lower priority construct is encountered
    int c;
    while ((c = peekChar()) != -1 && c != ')' && c != '|') {
      A concatRhs = parseQuantified();
      concatLhs = visitor.visitConcatenation(concatLhs, concatRhs);
    }

    return concatLhs;
  }

  /**
   * Parse an atom followed by an optional Kleene star.
   */
  private A parseQuantified() throws PatternSyntaxException {
    final A atom = parseAtom();
    return nextCharIf('*') ? visitor.visitKleene(atom) : atom;
  }

  /**
   * Parse a literal or a parenthesized expression.
   */
  private A parseAtom() throws PatternSyntaxException {
    final int c = peekChar();
    switch (c) {
      case '(': {
        final int openParenPosition = position;
        position++;
        final A grouped = parseAlternation();
        if (!nextCharIf(')')) {
          throw error("Expected `)` to close group (opened at " + openParenPosition + ")");
        }
        return grouped;
      }

      case '[':
      case '.':
        throw unsupported("Character classes");

      case '{':
        throw unsupported("Bounded repetitions");

      case '+':
      case '?':
        throw unsupported("Quantifiers other than `*`");

      case '^':
      case '$':
        throw unsupported("Anchors");

      case '\\':
        throw unsupported("Escapes and backreferences");

      // Reserved for the empty string and the empty language in synthesized text
      case 'ε':
      case '∅':
        throw error("Reserved symbol `" + (char) c + "` cannot be a literal");

      default:
        if (c != -1 && Character.isLetterOrDigit(c)) {
          return visitor.visitLiteral(nextChar());
        }
        throw error(c == -1 ? "Expected a literal or `(` but reached the end" : "Expected a literal or `(`");
    }
  }
}
