package fsa.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of an automaton.
 *
 * Transition keys are {@code "state,symbol"}. A DFA maps each key to a single
 * target state and an NFA maps it to an array of target states, with epsilon
 * edges written under the symbol {@code ε}.
 */
@JsonPropertyOrder({"type", "alphabet", "states", "initial", "final", "transitions"})
public record AutomatonDocument(
  @JsonProperty("type") String type,
  @JsonProperty("alphabet") List<String> alphabet,
  @JsonProperty("states") List<String> states,
  @JsonProperty("initial") String initial,
  @JsonProperty("final") List<String> accepting,
  @JsonProperty("transitions") Map<String, JsonNode> transitions
) {

  public static final String DFA = "dfa";
  public static final String NFA = "nfa";
}
