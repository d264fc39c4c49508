package com.github.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable 5-tuple (Q, Sigma, q0, F, delta) of a deterministic finite automaton.
 *
 * Notes for users:<br>
 * 1. instances are immutable and may be shared freely across threads and simulations<br>
 *
 * 2. delta is allowed to be partial. Totality is checked lazily by the {@link TransitionEngine} for
 * every transition actually attempted, or eagerly via {@link ValidationMode#STRICT}<br>
 *
 * 3. adding the same (state, symbol) pair twice with different targets keeps the latter. The
 * conflict is remembered so strict validation can flag the automaton as non-deterministic<br>
 *
 * 4. a symbol is a single {@code char}, so alphabets are limited to the Basic Multilingual Plane.
 * Input strings are consumed one char at a time<br>
 *
 * 5. use the {@link AutomatonDefinitionBuilder} to make one<br>
 */
public final class AutomatonDefinition {
  private final Set<String> states;
  private final Set<Character> alphabet;
  private final String initialState;
  private final Set<String> acceptingStates;
  private final Map<TransitionKey, String> transitions;
  private final Set<TransitionKey> conflictingTransitions;

  private AutomatonDefinition(final AutomatonDefinitionBuilder builder) {
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
    this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.alphabet));
    this.initialState = builder.initialState;
    this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.acceptingStates));
    this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.transitions));
    this.conflictingTransitions =
        Collections.unmodifiableSet(new LinkedHashSet<>(builder.conflictingTransitions));
  }

  public static AutomatonDefinitionBuilder newBuilder() {
    return new AutomatonDefinitionBuilder();
  }

  public Set<String> getStates() {
    return states;
  }

  public Set<Character> getAlphabet() {
    return alphabet;
  }

  public String getInitialState() {
    return initialState;
  }

  public Set<String> getAcceptingStates() {
    return acceptingStates;
  }

  public Map<TransitionKey, String> getTransitions() {
    return transitions;
  }

  /**
   * Pairs that were mapped to more than one distinct successor while building.
   */
  public Set<TransitionKey> getConflictingTransitions() {
    return conflictingTransitions;
  }

  public boolean hasState(final String state) {
    return state != null && states.contains(state);
  }

  public boolean hasSymbol(final char symbol) {
    return alphabet.contains(symbol);
  }

  public boolean isAccepting(final String state) {
    return state != null && acceptingStates.contains(state);
  }

  /**
   * Raw delta lookup with no membership checks. Empty iff the pair has no entry.
   */
  public Optional<String> lookup(final String state, final char symbol) {
    if (state == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(transitions.get(TransitionKey.of(state, symbol)));
  }

  /**
   * The transition table flattened back into its wire shape, in insertion order.
   */
  public List<Transition> toTransitionList() {
    final List<Transition> triples = new ArrayList<>(transitions.size());
    for (final Map.Entry<TransitionKey, String> entry : transitions.entrySet()) {
      triples.add(new Transition(entry.getKey().getState(), entry.getKey().getSymbol(),
          entry.getValue()));
    }
    return triples;
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, alphabet, initialState, acceptingStates, transitions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AutomatonDefinition)) {
      return false;
    }
    final AutomatonDefinition other = (AutomatonDefinition) obj;
    return states.equals(other.states) && alphabet.equals(other.alphabet)
        && Objects.equals(initialState, other.initialState)
        && acceptingStates.equals(other.acceptingStates) && transitions.equals(other.transitions);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("AutomatonDefinition:");
    builder.append("\n  States (Q): ").append(states);
    builder.append("\n  Alphabet (Σ): ").append(alphabet);
    builder.append("\n  Initial state (q0): ").append(initialState);
    builder.append("\n  Accepting states (F): ").append(acceptingStates);
    builder.append("\n  Transitions (δ):");
    for (final Transition transition : toTransitionList()) {
      builder.append("\n    ").append(transition);
    }
    return builder.toString();
  }

  /**
   * Fluent builder for {@link AutomatonDefinition}. Not thread-safe; build() snapshots everything
   * so the builder may be reused afterwards.
   */
  public final static class AutomatonDefinitionBuilder {
    private static final Logger logger =
        LogManager.getLogger(AutomatonDefinitionBuilder.class.getSimpleName());

    private final Set<String> states = new LinkedHashSet<>();
    private final Set<Character> alphabet = new LinkedHashSet<>();
    private String initialState;
    private final Set<String> acceptingStates = new LinkedHashSet<>();
    private final Map<TransitionKey, String> transitions = new LinkedHashMap<>();
    private final Set<TransitionKey> conflictingTransitions = new LinkedHashSet<>();

    public AutomatonDefinitionBuilder states(final String... states) {
      for (final String state : states) {
        this.states.add(state);
      }
      return this;
    }

    public AutomatonDefinitionBuilder states(final Collection<String> states) {
      this.states.addAll(states);
      return this;
    }

    public AutomatonDefinitionBuilder alphabet(final char... symbols) {
      for (final char symbol : symbols) {
        this.alphabet.add(symbol);
      }
      return this;
    }

    public AutomatonDefinitionBuilder alphabet(final Collection<Character> symbols) {
      this.alphabet.addAll(symbols);
      return this;
    }

    /**
     * Alphabet given as string labels, each of which has to be a single character.
     */
    public AutomatonDefinitionBuilder alphabetLabels(final Collection<String> labels)
        throws ValidationException {
      for (final String label : labels) {
        this.alphabet.add(Transition.toSymbol(label));
      }
      return this;
    }

    public AutomatonDefinitionBuilder initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public AutomatonDefinitionBuilder acceptingStates(final String... acceptingStates) {
      for (final String state : acceptingStates) {
        this.acceptingStates.add(state);
      }
      return this;
    }

    public AutomatonDefinitionBuilder acceptingStates(final Collection<String> acceptingStates) {
      this.acceptingStates.addAll(acceptingStates);
      return this;
    }

    public AutomatonDefinitionBuilder transition(final String fromState, final char symbol,
        final String toState) {
      return transition(new Transition(fromState, symbol, toState));
    }

    public AutomatonDefinitionBuilder transition(final Transition transition) {
      final TransitionKey key = transition.key();
      final String previous = transitions.put(key, transition.getToState());
      if (previous != null && !previous.equals(transition.getToState())) {
        logger.warn(String.format("Transition for %s already leads to %s, overwriting with %s",
            key, previous, transition.getToState()));
        conflictingTransitions.add(key);
      }
      return this;
    }

    public AutomatonDefinitionBuilder transitions(final Collection<Transition> transitions) {
      for (final Transition transition : transitions) {
        transition(transition);
      }
      return this;
    }

    public AutomatonDefinitionBuilder transitions(final Map<TransitionKey, String> transitions) {
      for (final Map.Entry<TransitionKey, String> entry : transitions.entrySet()) {
        transition(entry.getKey().getState(), entry.getKey().getSymbol(), entry.getValue());
      }
      return this;
    }

    /**
     * Build and run the structural checks.
     */
    public AutomatonDefinition build() throws ValidationException {
      return build(ValidationMode.STRUCTURAL);
    }

    public AutomatonDefinition build(final ValidationMode mode) throws ValidationException {
      final AutomatonDefinition definition = new AutomatonDefinition(this);
      AutomatonValidator.validate(definition, mode);
      return definition;
    }

    /**
     * Build without any validation. Simulator operations still re-check membership of every state
     * and symbol they touch.
     */
    public AutomatonDefinition buildUnvalidated() {
      return new AutomatonDefinition(this);
    }

    private AutomatonDefinitionBuilder() {}
  }

}
