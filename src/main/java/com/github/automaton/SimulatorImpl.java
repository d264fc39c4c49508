package com.github.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * Default {@link Simulator}. Holds nothing but its configuration; every operation is a pure
 * function of the definition, start state and input handed to it.
 */
public final class SimulatorImpl implements Simulator {
  private static final Logger logger = LogManager.getLogger(SimulatorImpl.class.getSimpleName());

  private final SimulatorConfiguration config;
  private final TransitionEngine engine = TransitionEngine.getInstance();

  SimulatorImpl(final SimulatorConfiguration config) {
    this.config = config;
  }

  @Override
  public String finalState(final AutomatonDefinition definition, final String state,
      final String input) throws ValidationException, SimulationException {
    prepare(definition, input);
    return run(definition, state, input, null);
  }

  @Override
  public String finalState(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException {
    return finalState(definition, initialStateOf(definition), input);
  }

  @Override
  public List<DerivationStep> derivation(final AutomatonDefinition definition, final String state,
      final String input) throws ValidationException, SimulationException {
    prepare(definition, input);
    final List<DerivationStep> steps = new ArrayList<>(input.length());
    run(definition, state, input, steps);
    return Collections.unmodifiableList(steps);
  }

  @Override
  public List<DerivationStep> derivation(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException {
    return derivation(definition, initialStateOf(definition), input);
  }

  @Override
  public boolean accepted(final AutomatonDefinition definition, final String state,
      final String input) throws ValidationException, SimulationException {
    return accepted(definition, state, input, null);
  }

  @Override
  public boolean accepted(final AutomatonDefinition definition, final String state,
      final String input, final Collection<String> acceptingStatesOverride)
      throws ValidationException, SimulationException {
    prepare(definition, input);
    Collection<String> acceptingStates = definition.getAcceptingStates();
    if (acceptingStatesOverride != null) {
      AutomatonValidator.validateAcceptingOverride(definition, acceptingStatesOverride);
      acceptingStates = acceptingStatesOverride;
    }
    final String reached = run(definition, state, input, null);
    final boolean accepted = acceptingStates.contains(reached);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Input '%s' from %s ended in %s: %s", input, state, reached,
          accepted ? "accepted" : "rejected"));
    }
    return accepted;
  }

  @Override
  public boolean accepted(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException {
    return accepted(definition, initialStateOf(definition), input, null);
  }

  @Override
  public SimulatorConfiguration getConfiguration() {
    return config;
  }

  private static String initialStateOf(final AutomatonDefinition definition) {
    return definition == null ? null : definition.getInitialState();
  }

  private void prepare(final AutomatonDefinition definition, final String input)
      throws ValidationException {
    if (definition == null || input == null) {
      throw new IllegalArgumentException("definition and input cannot be null");
    }
    if (config.getValidateOnEntry()) {
      AutomatonValidator.validate(definition, config.getValidationMode());
    }
  }

  /**
   * Walks the input from the given state, appending a step per symbol to steps when it is non-null.
   * Stops at the first transition failure.
   */
  private String run(final AutomatonDefinition definition, final String state, final String input,
      final List<DerivationStep> steps) throws SimulationException {
    if (!definition.hasState(state)) {
      throw fail(new TransitionException(Code.UNKNOWN_STATE, state, null));
    }
    String current = state;
    for (int position = 0; position < input.length(); position++) {
      final char symbol = input.charAt(position);
      final String next;
      try {
        next = engine.transition(definition, current, symbol);
      } catch (TransitionException stuck) {
        throw fail(stuck);
      }
      if (config.getTraceSteps() && logger.isDebugEnabled()) {
        logger.debug(String.format("[%d] δ(%s, %s) = %s", position, current, symbol, next));
      }
      if (steps != null) {
        steps.add(new DerivationStep(current, symbol, next));
      }
      current = next;
    }
    return current;
  }

  private static SimulationException fail(final TransitionException stuck) {
    if (logger.isDebugEnabled()) {
      logger.debug("Simulation stopped: " + stuck.getMessage());
    }
    return new SimulationException(stuck);
  }

}
