package com.github.automaton;

import java.util.Collection;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * Well-formedness checks for {@link AutomatonDefinition}. All checks are pure and fail fast on the
 * first violation, in a fixed order.
 */
public final class AutomatonValidator {
  private static final Logger logger =
      LogManager.getLogger(AutomatonValidator.class.getSimpleName());

  public static void validate(final AutomatonDefinition definition) throws ValidationException {
    validate(definition, ValidationMode.STRUCTURAL);
  }

  public static void validate(final AutomatonDefinition definition, final ValidationMode mode)
      throws ValidationException {
    if (definition == null) {
      throw new IllegalArgumentException("definition cannot be null");
    }
    // 1. Q and Sigma are non-empty
    if (definition.getStates().isEmpty()) {
      throw new ValidationException(Code.EMPTY_STATES);
    }
    if (definition.getAlphabet().isEmpty()) {
      throw new ValidationException(Code.EMPTY_ALPHABET);
    }

    // 2. q0 in Q
    if (!definition.hasState(definition.getInitialState())) {
      throw new ValidationException(Code.UNKNOWN_INITIAL_STATE,
          "Initial state '" + definition.getInitialState() + "' is not in " + definition.getStates());
    }

    // 3. F subset of Q
    checkAcceptingStates(definition, definition.getAcceptingStates());

    // 4. every delta key in Q x Sigma, 5. every delta value in Q
    for (final Map.Entry<TransitionKey, String> entry : definition.getTransitions().entrySet()) {
      final TransitionKey key = entry.getKey();
      if (!definition.hasState(key.getState()) || !definition.hasSymbol(key.getSymbol())) {
        throw new ValidationException(Code.INVALID_TRANSITION_DOMAIN,
            "Transition keyed on " + key + " is outside of Q x Σ");
      }
    }
    for (final Map.Entry<TransitionKey, String> entry : definition.getTransitions().entrySet()) {
      if (!definition.hasState(entry.getValue())) {
        throw new ValidationException(Code.INVALID_TRANSITION_TARGET,
            "Transition " + entry.getKey() + " leads to unknown state '" + entry.getValue() + "'");
      }
    }

    if (mode == ValidationMode.STRICT) {
      // 6. determinism
      if (!definition.getConflictingTransitions().isEmpty()) {
        throw new ValidationException(Code.NONDETERMINISTIC_TRANSITION,
            "Pairs mapped to more than one successor: " + definition.getConflictingTransitions());
      }
      // 7. totality
      for (final String state : definition.getStates()) {
        for (final Character symbol : definition.getAlphabet()) {
          if (!definition.lookup(state, symbol).isPresent()) {
            throw new ValidationException(Code.INCOMPLETE_TRANSITION_FUNCTION,
                "No transition defined for " + TransitionKey.of(state, symbol));
          }
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Validated automaton with %d states and %d transitions in %s mode",
          definition.getStates().size(), definition.getTransitions().size(), mode));
    }
  }

  /**
   * Checks an accepting-state set handed in for a single acceptance test against Q.
   */
  public static void validateAcceptingOverride(final AutomatonDefinition definition,
      final Collection<String> acceptingStates) throws ValidationException {
    checkAcceptingStates(definition, acceptingStates);
  }

  private static void checkAcceptingStates(final AutomatonDefinition definition,
      final Collection<String> acceptingStates) throws ValidationException {
    for (final String state : acceptingStates) {
      if (!definition.hasState(state)) {
        throw new ValidationException(Code.UNKNOWN_ACCEPTING_STATE,
            "Accepting state '" + state + "' is not in " + definition.getStates());
      }
    }
  }

  private AutomatonValidator() {}
}
