package fsa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs which are valid in richer regular
 * expression dialects but are intentionally not part of this grammar.
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -2410688211253476419L;

  /**
   * (Capitalized) name of the unsupported feature category.
   */
  public final String unsupportedFeatureCategory;

  public UnsupportedPatternSyntaxException(
    String unsupportedFeatureCategory,
    String regex,
    int index
  ) {
    super(unsupportedFeatureCategory + " are not supported", regex, index);
    this.unsupportedFeatureCategory = unsupportedFeatureCategory;
  }
}
