package fsa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Immutable regular expression tree.
 *
 * The variant is closed: every tree is built out of exactly the four node
 * kinds below, and {@link #accept} dispatches over them exhaustively.
 */
public sealed interface Regex
    permits Regex.Literal, Regex.Concatenation, Regex.Alternation, Regex.KleeneStar {

  /**
   * Matches exactly one symbol.
   *
   * @param symbol alphabet symbol
   */
  record Literal(char symbol) implements Regex { }

  /**
   * Matches {@code lhs} followed by {@code rhs}.
   */
  record Concatenation(Regex lhs, Regex rhs) implements Regex { }

  /**
   * Matches either {@code lhs} or {@code rhs}.
   */
  record Alternation(Regex lhs, Regex rhs) implements Regex { }

  /**
   * Matches {@code inner} zero or more times.
   */
  record KleeneStar(Regex inner) implements Regex { }

  /**
   * Parse a pattern into an explicit tree.
   *
   * @param pattern regular expression text
   * @return root of the tree
   */
  static Regex parse(String pattern) throws PatternSyntaxException {
    return RegexParser.parse(TreeBuilder.INSTANCE, pattern);
  }

  /**
   * Fold the tree bottom-up through a visitor.
   *
   * @param visitor visitor receiving the nodes, children first
   * @return output of the visitor for the root
   */
  default <R> R accept(RegexVisitor<R> visitor) {
    if (this instanceof Literal literal) {
      return visitor.visitLiteral(literal.symbol());
    } else if (this instanceof Concatenation concat) {
      final R lhs = concat.lhs().accept(visitor);
      final R rhs = concat.rhs().accept(visitor);
      return visitor.visitConcatenation(lhs, rhs);
    } else if (this instanceof Alternation alt) {
      final R lhs = alt.lhs().accept(visitor);
      final R rhs = alt.rhs().accept(visitor);
      return visitor.visitAlternation(lhs, rhs);
    } else if (this instanceof KleeneStar star) {
      return visitor.visitKleene(star.inner().accept(visitor));
    }
    throw new IllegalStateException("unexpected regex node " + this);
  }

  /**
   * Render the tree back into pattern text accepted by {@link RegexParser}.
   *
   * @return pattern text
   */
  default String pattern() {
    return accept(PatternPrinter.INSTANCE).text();
  }

  /**
   * Visitor which builds up the explicit tree.
   */
  final class TreeBuilder implements RegexVisitor<Regex> {

    static final TreeBuilder INSTANCE = new TreeBuilder();

    private TreeBuilder() { }

    @Override
    public Regex visitLiteral(char symbol) {
      return new Literal(symbol);
    }

    @Override
    public Regex visitConcatenation(Regex lhs, Regex rhs) {
      return new Concatenation(lhs, rhs);
    }

    @Override
    public Regex visitAlternation(Regex lhs, Regex rhs) {
      return new Alternation(lhs, rhs);
    }

    @Override
    public Regex visitKleene(Regex inner) {
      return new KleeneStar(inner);
    }
  }

  /**
   * Visitor which prints pattern text, tracking the precedence of the printed
   * fragment so that parentheses are only added where needed.
   */
  final class PatternPrinter implements RegexVisitor<PatternPrinter.Printed> {

    // 0 = alternation, 1 = concatenation, 2 = atom or starred atom
    record Printed(String text, int precedence) {

      String atLeast(int required) {
        return precedence >= required ? text : "(" + text + ")";
      }
    }

    static final PatternPrinter INSTANCE = new PatternPrinter();

    private PatternPrinter() { }

    @Override
    public Printed visitLiteral(char symbol) {
      return new Printed(String.valueOf(symbol), 2);
    }

    @Override
    public Printed visitConcatenation(Printed lhs, Printed rhs) {
      return new Printed(lhs.atLeast(1) + rhs.atLeast(1), 1);
    }

    @Override
    public Printed visitAlternation(Printed lhs, Printed rhs) {
      return new Printed(lhs.text() + "|" + rhs.text(), 0);
    }

    @Override
    public Printed visitKleene(Printed inner) {
      final boolean bareAtom = inner.precedence() == 2 && !inner.text().endsWith("*");
      return new Printed((bareAtom ? inner.text() : "(" + inner.text() + ")") + "*", 2);
    }
  }
}
