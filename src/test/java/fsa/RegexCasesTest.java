package fsa;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import fsa.graph.Nfa;
import fsa.graph.RegexSynthesizer;
import fsa.parser.Regex;
import fsa.util.Symbols;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Runs every case of {@code regex-cases.txt} through each stage of the
 * pipeline.
 */
@RunWith(Parameterized.class)
public class RegexCasesTest {

  @Parameters(name = "{0}")
  public static Collection<Object[]> cases() throws IOException {
    final List<Object[]> parameters = new ArrayList<>();
    try (var reader = new RegexCaseReader("/regex-cases.txt")) {
      for (RegexCase regexCase : reader.readAll()) {
        parameters.add(new Object[] { regexCase });
      }
    }
    return parameters;
  }

  private final RegexCase regexCase;
  private final List<Character> input;

  public RegexCasesTest(RegexCase regexCase) {
    this.regexCase = regexCase;
    this.input = Symbols.chars(regexCase.input);
  }

  @Test
  public void nfa() {
    final var nfa = Nfa.fromRegex(Regex.parse(regexCase.pattern));
    assertThat(regexCase.toString(), nfa.accepts(input), equalTo(regexCase.accepted));
  }

  @Test
  public void nfaWithoutEpsilon() {
    final var nfa = Nfa.parse(regexCase.pattern).withoutEpsilon();
    assertThat(regexCase.toString(), nfa.accepts(input), equalTo(regexCase.accepted));
  }

  @Test
  public void dfa() {
    final var dfa = Nfa.parse(regexCase.pattern).toDfa();
    assertThat(regexCase.toString(), dfa.accepts(input), equalTo(regexCase.accepted));
  }

  @Test
  public void minimalDfa() {
    final var dfa = Nfa.parse(regexCase.pattern).toDfa().minimized();
    assertThat(regexCase.toString(), dfa.accepts(input), equalTo(regexCase.accepted));
  }

  @Test
  public void transducer() {
    final var transducer = Nfa.parse(regexCase.pattern).transducer();
    transducer.pushAll(input);
    assertThat(regexCase.toString(), transducer.isAccepting(), equalTo(regexCase.accepted));
  }

  @Test
  public void printedPattern() {
    final var reparsed = Nfa.parse(Regex.parse(regexCase.pattern).pattern());
    assertThat(regexCase.toString(), reparsed.accepts(input), equalTo(regexCase.accepted));
  }

  @Test
  public void synthesizedAutomatonText() {
    final String synthesized = RegexSynthesizer.synthesize(Nfa.parse(regexCase.pattern).toDfa().minimized());
    final var rebuilt = Nfa.parse(synthesized);
    assertThat(regexCase + " via " + synthesized, rebuilt.accepts(input), equalTo(regexCase.accepted));
  }
}
