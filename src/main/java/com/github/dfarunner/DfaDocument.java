package com.github.dfarunner;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw, as-parsed view of a YAML DFA document:
 *
 * <pre>
 * description: Strings with an odd number of a's
 * states: [1, 2]
 * alphabet: [a, b]
 * start_state: 1
 * final_states: [2]
 * transitions:
 *   1: {a: 2, b: 1}
 *   2: {a: 1, b: 2}
 * accept_strings: [a, abbaa]
 * reject_strings: ["", abba]
 * regex: b*a(b*ab*a)*b*
 * </pre>
 *
 * Every scalar is bound as the text it was written with, so 01, yes and 1.50 stay exactly that
 * whether they appear in a list or as a mapping key. The last three fields describe the language
 * for testing and are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DfaDocument {
  @JsonProperty("description")
  private String description;

  @JsonProperty("states")
  private List<String> states;

  @JsonProperty("alphabet")
  private List<String> alphabet;

  // K=source state, V=(K=input symbol, V=destination state)
  @JsonProperty("transitions")
  private Map<String, Map<String, String>> transitions;

  @JsonProperty("start_state")
  private String startState;

  @JsonProperty("final_states")
  private List<String> finalStates;

  @JsonProperty("accept_strings")
  private List<String> acceptStrings;

  @JsonProperty("reject_strings")
  private List<String> rejectStrings;

  @JsonProperty("regex")
  private String regex;

  public String getDescription() {
    return description;
  }

  public List<String> getStates() {
    return states;
  }

  public List<String> getAlphabet() {
    return alphabet;
  }

  public Map<String, Map<String, String>> getTransitions() {
    return transitions;
  }

  public String getStartState() {
    return startState;
  }

  public List<String> getFinalStates() {
    return finalStates;
  }

  public List<String> getAcceptStrings() {
    return acceptStrings;
  }

  public List<String> getRejectStrings() {
    return rejectStrings;
  }

  public String getRegex() {
    return regex;
  }

  @Override
  public String toString() {
    return "DfaDocument [description=" + description + ", states=" + states + ", alphabet="
        + alphabet + ", transitions=" + transitions + ", startState=" + startState
        + ", finalStates=" + finalStates + "]";
  }
}
