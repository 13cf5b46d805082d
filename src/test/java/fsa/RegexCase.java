package fsa;

/**
 * Conformance case from a test file.
 */
public final class RegexCase {

  /**
   * Regular expression pattern.
   */
  public final String pattern;

  /**
   * Input fed to the automata built from the pattern.
   */
  public final String input;

  /**
   * Whether the input is in the language of the pattern.
   */
  public final boolean accepted;

  /**
   * Source file from which the case originated.
   */
  public final String resource;

  /**
   * Line in the source file on which the case starts.
   */
  public final int lineNumber;

  public RegexCase(String pattern, String input, boolean accepted, String resource, int lineNumber) {
    this.pattern = pattern;
    this.input = input;
    this.accepted = accepted;
    this.resource = resource;
    this.lineNumber = lineNumber;
  }

  @Override
  public String toString() {
    return "/" + pattern + "/ on \"" + input + "\" (at " + resource + ":" + lineNumber + ")";
  }
}
