package fsa.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fsa.graph.Dfa;
import fsa.graph.Fsm;
import fsa.graph.InvalidAutomatonException;
import fsa.graph.Nfa;
import fsa.util.States;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading and writing automata as JSON.
 *
 * States and symbols are written as their rendered text, so reading a
 * document back always produces an automaton over strings.
 */
public final class AutomatonJson {

  private static final Logger logger = LoggerFactory.getLogger(AutomatonJson.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(SerializationFeature.INDENT_OUTPUT);

  private AutomatonJson() { }

  /**
   * Describe an automaton as a document.
   *
   * @param fsm NFA or DFA
   * @return document with states and symbols rendered as text
   * @throws IllegalArgumentException if a symbol renders as the epsilon label
   *         or contains a comma, since its transitions could not be read back
   */
  public static <Q, E> AutomatonDocument toDocument(Fsm<Q, E> fsm) {
    final List<String> alphabet = new ArrayList<>();
    for (E symbol : fsm.alphabet()) {
      final String rendered = String.valueOf(symbol);
      if (Nfa.EPSILON_LABEL.equals(rendered) || rendered.contains(",")) {
        throw new IllegalArgumentException("Symbol `" + rendered + "` cannot be written to a transition key");
      }
      alphabet.add(rendered);
    }
    final List<Q> states = States.sorted(fsm.states());
    final Map<String, JsonNode> transitions = new LinkedHashMap<>();

    final String type;
    if (fsm instanceof Dfa<Q, E> dfa) {
      type = AutomatonDocument.DFA;
      for (Q state : states) {
        for (var entry : dfa.transitionsFrom(state).entrySet()) {
          transitions.put(
            key(state, String.valueOf(entry.getKey())),
            JsonNodeFactory.instance.textNode(States.render(entry.getValue()))
          );
        }
      }
    } else {
      type = AutomatonDocument.NFA;
      final Nfa<Q, E> nfa = fsm.toNfa();
      for (Q state : states) {
        for (var entry : nfa.transitionsFrom(state).entrySet()) {
          transitions.put(key(state, String.valueOf(entry.getKey())), targets(entry.getValue()));
        }
        if (!nfa.epsilonTargets(state).isEmpty()) {
          transitions.put(key(state, Nfa.EPSILON_LABEL), targets(nfa.epsilonTargets(state)));
        }
      }
    }

    return new AutomatonDocument(
      type,
      alphabet,
      render(states),
      States.render(fsm.initial()),
      render(States.sorted(fsm.accepting())),
      transitions
    );
  }

  /**
   * @param fsm NFA or DFA
   * @return indented JSON text
   */
  public static String write(Fsm<?, ?> fsm) throws JsonProcessingException {
    return MAPPER.writeValueAsString(toDocument(fsm));
  }

  /**
   * @param fsm NFA or DFA
   * @param path file to (over)write
   */
  public static void write(Fsm<?, ?> fsm, Path path) throws IOException {
    MAPPER.writeValue(path.toFile(), toDocument(fsm));
    logger.debug("wrote {} states to {}", fsm.states().size(), path);
  }

  /**
   * @param json JSON text
   * @return a {@link Dfa} or an {@link Nfa}, depending on the document type
   * @throws MalformedAutomatonException if the document is not a valid automaton
   */
  public static Fsm<String, String> read(String json) throws IOException {
    return fromDocument(MAPPER.readValue(json, AutomatonDocument.class));
  }

  /**
   * @param path JSON file
   * @return a {@link Dfa} or an {@link Nfa}, depending on the document type
   * @throws MalformedAutomatonException if the document is not a valid automaton
   */
  public static Fsm<String, String> read(Path path) throws IOException {
    final Fsm<String, String> fsm = fromDocument(MAPPER.readValue(path.toFile(), AutomatonDocument.class));
    logger.debug("read {} states from {}", fsm.states().size(), path);
    return fsm;
  }

  /**
   * Build the automaton a document describes.
   *
   * @param document parsed document
   * @return a {@link Dfa} or an {@link Nfa}, depending on the document type
   * @throws MalformedAutomatonException if a field is missing or the automaton is invalid
   */
  public static Fsm<String, String> fromDocument(AutomatonDocument document) throws MalformedAutomatonException {
    final String type = require(document.type(), "type");
    final List<String> alphabet = require(document.alphabet(), "alphabet");
    final List<String> states = require(document.states(), "states");
    final String initial = require(document.initial(), "initial");
    final List<String> accepting = require(document.accepting(), "final");
    if (alphabet.contains(Nfa.EPSILON_LABEL)) {
      throw new MalformedAutomatonException("Alphabet contains the epsilon label `" + Nfa.EPSILON_LABEL + "`");
    }
    final Map<String, JsonNode> transitions = document.transitions() == null
      ? Map.of()
      : document.transitions();

    try {
      if (AutomatonDocument.DFA.equals(type)) {
        final var builder = new Dfa.Builder<String, String>()
          .addSymbols(alphabet)
          .addStates(states)
          .setInitial(initial);
        accepting.forEach(builder::addAccepting);
        for (var entry : transitions.entrySet()) {
          final String[] key = splitKey(entry.getKey());
          if (!entry.getValue().isTextual()) {
            throw new MalformedAutomatonException(
              "DFA transition " + entry.getKey() + " must have a single target state"
            );
          }
          builder.addTransition(key[0], key[1], entry.getValue().asText());
        }
        return builder.build();
      } else if (AutomatonDocument.NFA.equals(type)) {
        final var builder = new Nfa.Builder<String, String>()
          .addSymbols(alphabet)
          .addStates(states)
          .setInitial(initial);
        accepting.forEach(builder::addAccepting);
        for (var entry : transitions.entrySet()) {
          final String[] key = splitKey(entry.getKey());
          for (String target : targetList(entry.getKey(), entry.getValue())) {
            if (Nfa.EPSILON_LABEL.equals(key[1])) {
              builder.addEpsilonTransition(key[0], target);
            } else {
              builder.addTransition(key[0], key[1], target);
            }
          }
        }
        return builder.build();
      } else {
        throw new MalformedAutomatonException("Unknown automaton type `" + type + "`");
      }
    } catch (InvalidAutomatonException e) {
      throw new MalformedAutomatonException("Invalid automaton: " + e.getMessage(), e);
    }
  }

  private static String key(Object state, String symbol) {
    return States.render(state) + "," + symbol;
  }

  /**
   * Split a transition key at its last comma, so states may contain commas
   * (as rendered sets do) but symbols may not.
   */
  private static String[] splitKey(String key) throws MalformedAutomatonException {
    final int comma = key.lastIndexOf(',');
    if (comma < 0) {
      throw new MalformedAutomatonException("Transition key `" + key + "` is not of the form state,symbol");
    }
    return new String[] { key.substring(0, comma), key.substring(comma + 1) };
  }

  private static List<String> targetList(String key, JsonNode value) throws MalformedAutomatonException {
    final List<String> targets = new ArrayList<>();
    if (value.isTextual()) {
      targets.add(value.asText());
    } else if (value.isArray()) {
      for (JsonNode target : value) {
        if (!target.isTextual()) {
          throw new MalformedAutomatonException("NFA transition " + key + " has a non-string target");
        }
        targets.add(target.asText());
      }
    } else {
      throw new MalformedAutomatonException("NFA transition " + key + " must map to an array of states");
    }
    return targets;
  }

  private static ArrayNode targets(Set<?> states) {
    final ArrayNode array = JsonNodeFactory.instance.arrayNode();
    for (Object state : States.sorted(states)) {
      array.add(States.render(state));
    }
    return array;
  }

  private static List<String> render(List<?> states) {
    final List<String> rendered = new ArrayList<>();
    for (Object state : states) {
      rendered.add(States.render(state));
    }
    return rendered;
  }

  private static <T> T require(T value, String field) throws MalformedAutomatonException {
    if (value == null) {
      throw new MalformedAutomatonException("Missing field `" + field + "`");
    }
    return value;
  }
}
