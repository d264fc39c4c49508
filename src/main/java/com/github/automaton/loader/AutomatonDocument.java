package com.github.automaton.loader;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.github.automaton.AutomatonDefinition;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.Transition;
import com.github.automaton.ValidationException;

/**
 * Wire shape shared by the JSON and YAML formats. delta is a list of [from, symbol, to] triples.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
@JsonPropertyOrder({"Q", "Sigma", "q0", "F", "delta"})
final class AutomatonDocument {
  @JsonProperty("Q")
  private List<String> states;

  @JsonProperty("Sigma")
  private List<String> alphabet;

  @JsonProperty("q0")
  private String initialState;

  @JsonProperty("F")
  private List<String> acceptingStates;

  @JsonProperty("delta")
  private List<List<String>> transitions;

  AutomatonDocument() {}

  static AutomatonDocument from(final AutomatonDefinition definition) {
    final AutomatonDocument document = new AutomatonDocument();
    document.states = new ArrayList<>(definition.getStates());
    document.alphabet = new ArrayList<>();
    for (final Character symbol : definition.getAlphabet()) {
      document.alphabet.add(String.valueOf(symbol));
    }
    document.initialState = definition.getInitialState();
    document.acceptingStates = new ArrayList<>(definition.getAcceptingStates());
    document.transitions = new ArrayList<>();
    for (final Transition transition : definition.toTransitionList()) {
      final List<String> triple = new ArrayList<>(3);
      triple.add(transition.getFromState());
      triple.add(String.valueOf(transition.getSymbol()));
      triple.add(transition.getToState());
      document.transitions.add(triple);
    }
    return document;
  }

  AutomatonDefinition toDefinition() throws ValidationException {
    final StringBuilder missing = new StringBuilder();
    if (states == null) {
      missing.append("Q ");
    }
    if (alphabet == null) {
      missing.append("Sigma ");
    }
    if (initialState == null) {
      missing.append("q0 ");
    }
    if (acceptingStates == null) {
      missing.append("F ");
    }
    if (transitions == null) {
      missing.append("delta ");
    }
    if (missing.length() > 0) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Missing keys: " + missing.toString().trim());
    }
    final AutomatonDefinition.AutomatonDefinitionBuilder builder = AutomatonDefinition.newBuilder()
        .states(states).alphabetLabels(alphabet).initialState(initialState)
        .acceptingStates(acceptingStates);
    for (final List<String> triple : transitions) {
      if (triple == null || triple.size() != 3 || triple.contains(null)) {
        throw new ValidationException(Code.MALFORMED_DEFINITION,
            "Transition must be a [from, symbol, to] triple, got " + triple);
      }
      builder.transition(Transition.of(triple.get(0), triple.get(1), triple.get(2)));
    }
    return builder.build();
  }
}
