package fsa.json;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import fsa.graph.Dfa;
import fsa.graph.Fsm;
import fsa.graph.InvalidAutomatonException;
import fsa.graph.Nfa;
import fsa.util.Words;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AutomatonJsonTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static List<String> strings(List<Character> word) {
    final List<String> result = new ArrayList<>();
    for (Character symbol : word) {
      result.add(String.valueOf(symbol));
    }
    return result;
  }

  private static void assertSameLanguage(Fsm<?, Character> original, Fsm<String, String> read) {
    for (List<Character> word : Words.upTo(original.alphabet(), 6)) {
      assertThat(word.toString(), read.accepts(strings(word)), equalTo(original.accepts(word)));
    }
  }

  @Test
  public void dfaRoundTrip() throws Exception {
    final var dfa = Nfa.parse("(a|b)*abb").toDfa();
    final String json = AutomatonJson.write(dfa);
    assertThat(json, containsString("\"type\" : \"dfa\""));

    final var read = AutomatonJson.read(json);
    assertThat(read, instanceOf(Dfa.class));
    assertThat(read.states().size(), equalTo(dfa.states().size()));
    assertSameLanguage(dfa, read);
  }

  @Test
  public void nfaRoundTripKeepsEpsilonEdges() throws Exception {
    final var nfa = Nfa.parse("a|b*");
    final String json = AutomatonJson.write(nfa);
    assertThat(json, containsString("\"type\" : \"nfa\""));
    assertThat(json, containsString("\"0,ε\" : [ \"1\", \"3\" ]"));

    final var read = AutomatonJson.read(json);
    assertThat(read, instanceOf(Nfa.class));
    assertTrue(((Nfa<String, String>) read).hasEpsilonTransitions());
    assertSameLanguage(nfa, read);
  }

  @Test
  public void documentShape() {
    final var document = AutomatonJson.toDocument(Nfa.parse("ab").toDfa());
    assertThat(document.type(), equalTo(AutomatonDocument.DFA));
    assertThat(document.alphabet(), equalTo(List.of("a", "b")));
    assertThat(document.states(), equalTo(List.of("{0}", "{1,2}", "{3}")));
    assertThat(document.initial(), equalTo("{0}"));
    assertThat(document.accepting(), equalTo(List.of("{3}")));
    assertThat(document.transitions().get("{1,2},b").asText(), equalTo("{3}"));
  }

  @Test
  public void readHandWrittenDfa() throws Exception {
    final String json = "{"
      + "\"type\": \"dfa\","
      + "\"alphabet\": [\"0\", \"1\"],"
      + "\"states\": [\"s\", \"t\"],"
      + "\"initial\": \"s\","
      + "\"final\": [\"t\"],"
      + "\"transitions\": {\"s,0\": \"t\", \"t,1\": \"s\"}"
      + "}";
    final var dfa = AutomatonJson.read(json);
    assertTrue(dfa.accepts(List.of("0")));
    assertTrue(dfa.accepts(List.of("0", "1", "0")));
    assertFalse(dfa.accepts(List.of("0", "1")));
    assertFalse(dfa.accepts(List.of("1")));
  }

  @Test
  public void readNfaWithSingleTargetShorthand() throws Exception {
    final String json = "{"
      + "\"type\": \"nfa\","
      + "\"alphabet\": [\"x\"],"
      + "\"states\": [\"p\", \"q\"],"
      + "\"initial\": \"p\","
      + "\"final\": [\"q\"],"
      + "\"transitions\": {\"p,x\": \"q\"}"
      + "}";
    assertTrue(AutomatonJson.read(json).accepts(List.of("x")));
  }

  @Test
  public void fileRoundTrip() throws Exception {
    final Path path = folder.newFile("minimal.json").toPath();
    final var minimal = Nfa.parse("(a|b)*abb").toDfa().minimized();
    AutomatonJson.write(minimal, path);
    final var read = AutomatonJson.read(path);
    assertThat(read.states().size(), equalTo(4));
    assertSameLanguage(minimal, read);
  }

  @Test
  public void missingFieldIsMalformed() {
    final var e = assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read("{\"type\": \"dfa\", \"alphabet\": [], \"states\": [\"s\"], \"final\": []}")
    );
    assertThat(e.getMessage(), equalTo("Missing field `initial`"));
  }

  @Test
  public void unknownTypeIsMalformed() {
    assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read(
        "{\"type\": \"pda\", \"alphabet\": [], \"states\": [\"s\"], \"initial\": \"s\", \"final\": []}"
      )
    );
  }

  @Test
  public void brokenInvariantIsMalformed() {
    final var e = assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read(
        "{\"type\": \"nfa\", \"alphabet\": [\"a\"], \"states\": [\"s\"], \"initial\": \"s\", \"final\": [],"
          + " \"transitions\": {\"s,a\": [\"t\"]}}"
      )
    );
    assertThat(e.getCause(), instanceOf(InvalidAutomatonException.class));
  }

  @Test
  public void dfaTargetMustBeSingle() {
    assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read(
        "{\"type\": \"dfa\", \"alphabet\": [\"a\"], \"states\": [\"s\"], \"initial\": \"s\", \"final\": [],"
          + " \"transitions\": {\"s,a\": [\"s\"]}}"
      )
    );
  }

  @Test
  public void keyWithoutSymbolIsMalformed() {
    assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read(
        "{\"type\": \"dfa\", \"alphabet\": [\"a\"], \"states\": [\"s\"], \"initial\": \"s\", \"final\": [],"
          + " \"transitions\": {\"s\": \"s\"}}"
      )
    );
  }

  @Test
  public void epsilonSymbolIsNotWritten() {
    final var nfa = new Nfa.Builder<String, String>()
      .addSymbols(List.of("a", Nfa.EPSILON_LABEL))
      .addStates(List.of("p", "q"))
      .setInitial("p")
      .addAccepting("q")
      .addTransition("p", Nfa.EPSILON_LABEL, "q")
      .build();
    final var e = assertThrows(IllegalArgumentException.class, () -> AutomatonJson.write(nfa));
    assertThat(e.getMessage(), containsString(Nfa.EPSILON_LABEL));

    final var dfa = new Dfa.Builder<String, Character>()
      .addSymbol('ε')
      .addState("p")
      .setInitial("p")
      .addTransition("p", 'ε', "p")
      .build();
    assertThrows(IllegalArgumentException.class, () -> AutomatonJson.toDocument(dfa));
  }

  @Test
  public void epsilonInAlphabetIsMalformed() {
    final var e = assertThrows(
      MalformedAutomatonException.class,
      () -> AutomatonJson.read(
        "{\"type\": \"dfa\", \"alphabet\": [\"ε\"], \"states\": [\"s\"], \"initial\": \"s\", \"final\": [\"s\"],"
          + " \"transitions\": {\"s,ε\": \"s\"}}"
      )
    );
    assertThat(e.getMessage(), containsString("epsilon"));
  }

  @Test
  public void invalidJsonPropagatesParserError() {
    assertThrows(JsonProcessingException.class, () -> AutomatonJson.read("{\"type\": "));
  }
}
