package fsa.graph;

/**
 * An automaton was declared in a way that breaks one of its structural
 * invariants (eg. a transition pointing at an undeclared state).
 */
public class InvalidAutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3304822750162213897L;

  /**
   * Short name of the invariant which was violated.
   */
  public final String invariant;

  public InvalidAutomatonException(String invariant, String detail) {
    super(invariant + ": " + detail);
    this.invariant = invariant;
  }
}
